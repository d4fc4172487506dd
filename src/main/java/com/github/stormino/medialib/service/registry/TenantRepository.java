package com.github.stormino.medialib.service.registry;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Tenant rows. Tenants are created lazily, the first time anything is stored for them.
 */
@Repository
public class TenantRepository {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate insertTemplate;

    public TenantRepository(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.insertTemplate = new TransactionTemplate(transactionManager);
        this.insertTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    public void ensureExists(long tenantId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM tenants WHERE id = ?", Integer.class, tenantId);
        if (count != null && count > 0) {
            return;
        }
        try {
            insertTemplate.executeWithoutResult(status -> jdbcTemplate.update(
                    "INSERT INTO tenants (id, created_at) VALUES (?, ?)",
                    tenantId, Timestamp.valueOf(LocalDateTime.now())));
        } catch (DuplicateKeyException e) {
            // Created concurrently
        }
    }

    public Optional<String> findCredential(long tenantId) {
        return jdbcTemplate.query(
                "SELECT credential_data FROM tenants WHERE id = ?",
                (rs, rowNum) -> rs.getString("credential_data"),
                tenantId
        ).stream().filter(value -> value != null && !value.isBlank()).findFirst();
    }

    public void updateCredential(long tenantId, String credentialData) {
        ensureExists(tenantId);
        jdbcTemplate.update("UPDATE tenants SET credential_data = ? WHERE id = ?", credentialData, tenantId);
    }
}
