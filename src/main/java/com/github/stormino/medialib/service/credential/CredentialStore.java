package com.github.stormino.medialib.service.credential;

import java.util.Optional;

/**
 * Per-tenant acquisition credentials: cookie-jar text in the tool's format.
 * Validation happens at the request boundary, not here.
 */
public interface CredentialStore {

    Optional<String> get(long tenantId);

    void set(long tenantId, String credentialData);
}
