package com.polyglot.translationGateway.translation.provider;

/**
 * Failure classes reported by translation providers.
 */
public enum ProviderErrorKind {
    /** Timeout, 5xx, connection reset, backend throttling. Retryable. */
    TRANSIENT,
    /** Bad language pair, quota exceeded, malformed glossary. Not retryable. */
    PERMANENT
}
