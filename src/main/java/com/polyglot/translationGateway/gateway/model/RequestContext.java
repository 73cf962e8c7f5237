package com.polyglot.translationGateway.gateway.model;

import com.polyglot.translationGateway.auth.model.Identity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request context passed through the system once a request passed the auth and rate-limit gate.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestContext {

    /**
     * Caller resolved from the bearer token. Lives for this request only.
     */
    private Identity identity;

    /**
     * Correlation ID for request tracking and audit.
     */
    private String correlationId;

    /**
     * Admissions left in the caller's current rate-limit window.
     */
    private int remainingRequests;

    /**
     * Timestamp when request was received at the gateway.
     */
    private Instant receivedAt;
}
