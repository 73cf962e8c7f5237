package com.polyglot.translationGateway.auth.service;

import com.polyglot.translationGateway.auth.model.Identity;
import com.polyglot.translationGateway.config.GatewayProperties;
import com.polyglot.translationGateway.gateway.exception.ForbiddenException;
import com.polyglot.translationGateway.gateway.exception.UnauthorizedException;
import com.polyglot.translationGateway.gateway.util.IdentityMasker;
import com.polyglot.translationGateway.telemetry.GatewayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves an {@code Authorization: Bearer <key>} header to an {@link Identity}.
 *
 * The key is hashed before the credential store sees it. The store lookup is bounded by
 * {@code gateway.auth.lookup-timeout-ms}; a slow or failing store rejects the request.
 */
@Slf4j
@Service
public class Authenticator {

    private static final Logger AUDIT = LoggerFactory.getLogger("audit");
    private static final String BEARER_PREFIX = "Bearer ";

    private final CredentialStore credentialStore;
    private final ExecutorService authExecutor;
    private final GatewayProperties properties;
    private final GatewayMetrics metrics;

    public Authenticator(
            CredentialStore credentialStore,
            @Qualifier("authExecutor") ExecutorService authExecutor,
            GatewayProperties properties,
            GatewayMetrics metrics) {
        this.credentialStore = credentialStore;
        this.authExecutor = authExecutor;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * @param authorizationHeader raw header value, may be null
     * @param correlationId       request correlation id for the audit trail
     * @throws UnauthorizedException if no bearer token is present
     * @throws ForbiddenException    if the token is unknown or could not be checked
     */
    public Identity authenticate(String authorizationHeader, String correlationId) {
        String token = extractBearerToken(authorizationHeader);
        if (token == null) {
            audit("AUTH_MISSING", correlationId, null);
            metrics.authDecision("missing");
            throw new UnauthorizedException("Missing or malformed bearer token");
        }

        String fingerprint = DigestUtils.sha256Hex(token);
        Optional<String> subject = lookup(fingerprint, correlationId);
        if (subject.isEmpty()) {
            audit("AUTH_REJECTED", correlationId, fingerprint);
            metrics.authDecision("rejected");
            throw new ForbiddenException("Credential not accepted");
        }

        Identity identity = new Identity(subject.get(), fingerprint);
        audit("AUTH_OK", correlationId, identity.getSubjectId());
        metrics.authDecision("ok");
        return identity;
    }

    private Optional<String> lookup(String fingerprint, String correlationId) {
        long timeoutMs = properties.getAuth().getLookupTimeoutMs();
        Future<Optional<String>> future;
        try {
            future = authExecutor.submit(() -> credentialStore.findSubjectByKeyHash(fingerprint));
        } catch (RejectedExecutionException e) {
            throw reject(correlationId, fingerprint, "AUTH_REJECTED", "Credential store unavailable", e);
        }
        try {
            Optional<String> subject = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return subject == null ? Optional.empty() : subject;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Credential lookup timed out - correlationId: {}, timeoutMs: {}", correlationId, timeoutMs);
            throw reject(correlationId, fingerprint, "AUTH_TIMEOUT", "Credential check timed out", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw reject(correlationId, fingerprint, "AUTH_TIMEOUT", "Credential check interrupted", e);
        } catch (ExecutionException e) {
            log.warn("Credential lookup failed - correlationId: {}, error: {}", correlationId, e.getCause().getMessage());
            throw reject(correlationId, fingerprint, "AUTH_REJECTED", "Credential check failed", e.getCause());
        }
    }

    private ForbiddenException reject(String correlationId, String fingerprint, String event, String message, Throwable cause) {
        audit(event, correlationId, fingerprint);
        metrics.authDecision("AUTH_TIMEOUT".equals(event) ? "timeout" : "rejected");
        return new ForbiddenException(message, cause);
    }

    private static String extractBearerToken(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        if (value.length() < BEARER_PREFIX.length()
                || !value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = value.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static void audit(String event, String correlationId, String principal) {
        AUDIT.info("event: {}, correlationId: {}, principal: {}", event, correlationId, IdentityMasker.mask(principal));
    }
}
