package com.polyglot.translationGateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway configuration bound from the {@code gateway.*} namespace.
 *
 * Every option can be overridden from the environment through relaxed binding,
 * e.g. {@code GATEWAY_CACHE_TTL_SECONDS=600}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * Upper bound for the whole provider dispatch of one request.
     */
    @Min(1)
    private long requestTimeoutMs = 30_000L;

    /**
     * Maximum number of texts accepted in a single translate request.
     */
    @Min(1)
    private int maxTextsPerRequest = 128;

    @Valid
    private Cache cache = new Cache();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Provider provider = new Provider();

    @Valid
    private Auth auth = new Auth();

    public Duration requestTimeout() {
        return Duration.ofMillis(requestTimeoutMs);
    }

    @Data
    public static class Cache {

        /** Translation memory entry lifetime. */
        @Min(1)
        private long ttlSeconds = 86_400L;

        /** Entry-count ceiling before size eviction kicks in. */
        @Min(1)
        private long maxEntries = 50_000L;

        public Duration ttl() {
            return Duration.ofSeconds(ttlSeconds);
        }
    }

    @Data
    public static class RateLimit {

        @Min(1)
        private long windowMs = 60_000L;

        @Min(1)
        private int maxRequests = 60;
    }

    @Data
    public static class Provider {

        /**
         * Provider ids in the order they are tried. The first one is the primary,
         * the rest are fallbacks.
         */
        @NotEmpty
        private List<String> chain = new ArrayList<>(List.of("on-device"));

        /** Total attempts per provider for transient errors, first call included. */
        @Min(1)
        private int maxRetries = 3;

        /** First backoff interval; doubles per retry with jitter. */
        @Min(1)
        private long retryBaseDelayMs = 200L;

        @Min(1)
        private long retryMaxDelayMs = 5_000L;

        @Min(1)
        private int maxUnitsPerCall = 25;

        /** Threads available for concurrent provider groups. */
        @Min(1)
        private int parallelism = 8;
    }

    @Data
    public static class Auth {

        @Min(1)
        private long lookupTimeoutMs = 500L;

        /**
         * Raw API key to subject id. The credential store indexes these by key hash.
         */
        private Map<String, String> apiKeys = new LinkedHashMap<>();
    }
}
