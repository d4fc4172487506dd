package com.github.stormino.medialib.controller;

import com.github.stormino.medialib.exception.InvalidCredentialException;
import com.github.stormino.medialib.model.CredentialUpload;
import com.github.stormino.medialib.service.credential.CookieJarValidator;
import com.github.stormino.medialib.service.credential.CredentialStore;
import com.github.stormino.medialib.util.AcquisitionConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/auth/cookies")
@RequiredArgsConstructor
public class CredentialController {

    private final CredentialStore credentialStore;
    private final CookieJarValidator validator;

    @PostMapping
    public ResponseEntity<Map<String, Object>> store(
            @RequestHeader(value = AcquisitionConstants.TENANT_HEADER, required = false) Long tenantId,
            @RequestBody CredentialUpload upload) {

        long tenant = TenantHeader.require(tenantId);
        String cookies;
        try {
            cookies = validator.requireValid(upload.getCookies());
        } catch (InvalidCredentialException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        credentialStore.set(tenant, cookies);
        return ResponseEntity.ok(Map.of("configured", true));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> status(
            @RequestHeader(value = AcquisitionConstants.TENANT_HEADER, required = false) Long tenantId) {
        long tenant = TenantHeader.require(tenantId);
        return ResponseEntity.ok(Map.of("configured", credentialStore.get(tenant).isPresent()));
    }
}
