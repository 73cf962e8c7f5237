package com.polyglot.translationGateway.translation.model;

import com.polyglot.translationGateway.translation.provider.ProviderErrorKind;
import lombok.Builder;
import lombok.Value;

/**
 * Why a single unit could not be translated.
 */
@Value
@Builder
public class UnitFailure {

    int index;

    ProviderErrorKind kind;

    /**
     * Short machine readable reason, e.g. {@code UNSUPPORTED_LANGUAGE_PAIR}.
     */
    String reason;

    String message;

    public boolean isRetryable() {
        return kind == ProviderErrorKind.TRANSIENT;
    }
}
