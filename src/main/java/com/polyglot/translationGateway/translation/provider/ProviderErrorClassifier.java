package com.polyglot.translationGateway.translation.provider;

import com.polyglot.translationGateway.translation.exception.ProviderException;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps HTTP client failures of remote providers to transient or permanent provider errors.
 */
public final class ProviderErrorClassifier {

    private static final int QUOTA_EXCEEDED_DEEPL_STYLE = 456;

    private ProviderErrorClassifier() {
    }

    public static ProviderException classify(String providerId, RestClientException e) {
        if (e instanceof RestClientResponseException responseException) {
            return classifyStatus(providerId, responseException.getStatusCode(), e);
        }
        if (e instanceof ResourceAccessException) {
            return ProviderException.transientError(providerId, "IO_ERROR",
                    "Provider " + providerId + " unreachable: " + e.getMessage(), e);
        }
        return ProviderException.transientError(providerId, "CLIENT_ERROR",
                "Provider " + providerId + " call failed: " + e.getMessage(), e);
    }

    static ProviderException classifyStatus(String providerId, HttpStatusCode status, Exception cause) {
        int code = status.value();
        String message = "Provider " + providerId + " responded with HTTP " + code;
        if (code == 429) {
            return ProviderException.transientError(providerId, "THROTTLED", message, cause);
        }
        if (status.is5xxServerError()) {
            return ProviderException.transientError(providerId, "UPSTREAM_" + code, message, cause);
        }
        if (code == 403 || code == QUOTA_EXCEEDED_DEEPL_STYLE) {
            return ProviderException.permanent(providerId, "QUOTA_EXCEEDED", message, cause);
        }
        if (code == 401) {
            return ProviderException.permanent(providerId, "PROVIDER_AUTH", message, cause);
        }
        return ProviderException.permanent(providerId, "REJECTED_" + code, message, cause);
    }
}
