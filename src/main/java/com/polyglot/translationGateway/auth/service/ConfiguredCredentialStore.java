package com.polyglot.translationGateway.auth.service;

import com.polyglot.translationGateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Credential store backed by {@code gateway.auth.api-keys}. Keys are hashed once at startup.
 */
@Slf4j
@Component
public class ConfiguredCredentialStore implements CredentialStore {

    private final Map<String, String> subjectsByKeyHash;

    public ConfiguredCredentialStore(GatewayProperties properties) {
        Map<String, String> hashed = new HashMap<>();
        properties.getAuth().getApiKeys().forEach((key, subject) -> {
            if (key == null || key.isBlank() || subject == null || subject.isBlank()) {
                throw new IllegalStateException("gateway.auth.api-keys entries need a non-blank key and subject");
            }
            hashed.put(DigestUtils.sha256Hex(key), subject);
        });
        this.subjectsByKeyHash = Map.copyOf(hashed);
        log.info("Credential store initialized - keys: {}", subjectsByKeyHash.size());
    }

    @Override
    public Optional<String> findSubjectByKeyHash(String keyHash) {
        return Optional.ofNullable(subjectsByKeyHash.get(keyHash));
    }
}
