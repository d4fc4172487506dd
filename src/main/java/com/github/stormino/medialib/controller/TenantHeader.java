package com.github.stormino.medialib.controller;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Tenant identity as passed in by the authenticating front end.
 */
final class TenantHeader {

    private TenantHeader() {
    }

    static long require(Long tenantId) {
        if (tenantId == null) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing tenant");
        }
        return tenantId;
    }
}
