package com.polyglot.translationGateway.auth.model;

import lombok.Value;

/**
 * Authenticated caller, valid for a single request. Never persisted.
 */
@Value
public class Identity {

    String subjectId;

    /**
     * SHA-256 hex of the presented credential. The raw credential is not retained.
     */
    String credentialFingerprint;
}
