package com.polyglot.translationGateway.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Service for generating correlation IDs for request tracking.
 */
@Service
public class CorrelationIdService {

    public static final String HEADER = "X-Correlation-ID";

    private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    /**
     * Generates a unique correlation ID for request tracking.
     *
     * @return A UUID-based correlation ID
     */
    public String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Keeps a caller supplied correlation ID when it is safe to log, otherwise generates one.
     */
    public String resolve(String candidate) {
        if (candidate != null && ACCEPTED.matcher(candidate.trim()).matches()) {
            return candidate.trim();
        }
        return generateCorrelationId();
    }
}
