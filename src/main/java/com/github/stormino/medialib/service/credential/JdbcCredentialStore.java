package com.github.stormino.medialib.service.credential;

import com.github.stormino.medialib.service.registry.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcCredentialStore implements CredentialStore {

    private final TenantRepository tenantRepository;

    @Override
    public Optional<String> get(long tenantId) {
        return tenantRepository.findCredential(tenantId);
    }

    @Override
    public void set(long tenantId, String credentialData) {
        tenantRepository.updateCredential(tenantId, credentialData);
        log.info("Stored acquisition credential for tenant {}", tenantId);
    }
}
