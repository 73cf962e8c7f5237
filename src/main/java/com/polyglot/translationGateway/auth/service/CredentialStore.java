package com.polyglot.translationGateway.auth.service;

import java.util.Optional;

/**
 * Account storage capability. Only key hashes ever reach an implementation.
 */
public interface CredentialStore {

    /**
     * @param keyHash SHA-256 hex of the API key
     * @return subject id owning the key, empty if the key is unknown or revoked
     */
    Optional<String> findSubjectByKeyHash(String keyHash);
}
