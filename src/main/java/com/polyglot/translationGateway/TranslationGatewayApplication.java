package com.polyglot.translationGateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TranslationGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(TranslationGatewayApplication.class, args);
    }
}
