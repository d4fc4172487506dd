package com.github.stormino.medialib.service.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.stormino.medialib.exception.RegistrationException;
import com.github.stormino.medialib.model.Asset;
import com.github.stormino.medialib.model.LibraryEntry;
import com.github.stormino.medialib.service.storage.ArtifactStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Repository
public class JdbcTenantLibrary implements TenantLibrary {

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() { };

    private final JdbcTemplate jdbcTemplate;
    private final ContentRegistry contentRegistry;
    private final TenantRepository tenantRepository;
    private final ArtifactStore artifactStore;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate insertTemplate;

    public JdbcTenantLibrary(JdbcTemplate jdbcTemplate,
                             ContentRegistry contentRegistry,
                             TenantRepository tenantRepository,
                             ArtifactStore artifactStore,
                             ObjectMapper objectMapper,
                             PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.contentRegistry = contentRegistry;
        this.tenantRepository = tenantRepository;
        this.artifactStore = artifactStore;
        this.objectMapper = objectMapper;
        this.insertTemplate = new TransactionTemplate(transactionManager);
        this.insertTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    @Override
    public void attach(long tenantId, long assetId, Map<String, Object> metadata) {
        String json = toJson(metadata);
        try {
            tenantRepository.ensureExists(tenantId);
            if (updateMetadata(tenantId, assetId, json) > 0) {
                log.debug("Replaced library metadata for tenant={} asset={}", tenantId, assetId);
                return;
            }
            try {
                insertTemplate.executeWithoutResult(status -> jdbcTemplate.update(
                        "INSERT INTO library_entries (tenant_id, asset_id, metadata) VALUES (?, ?, ?)",
                        tenantId,
                        assetId,
                        json
                ));
            } catch (DuplicateKeyException e) {
                updateMetadata(tenantId, assetId, json);
            }
            log.debug("Attached asset={} to tenant={}", assetId, tenantId);
        } catch (DataAccessException e) {
            throw new RegistrationException("Failed to attach asset to library: " + e.getMessage(),
                    String.valueOf(assetId), e);
        }
    }

    @Override
    public Map<String, Map<String, Object>> list(long tenantId) {
        Map<String, Map<String, Object>> library = new LinkedHashMap<>();
        for (LibraryEntry entry : entries(tenantId)) {
            if (artifactStore.exists(entry.getStorageKey())) {
                library.put(entry.getStorageKey(), entry.getMetadata());
            } else {
                log.debug("Hiding library entry {} for tenant {}: bytes missing", entry.getStorageKey(), tenantId);
            }
        }
        return library;
    }

    @Override
    public List<LibraryEntry> entries(long tenantId) {
        return jdbcTemplate.query(
                """
                SELECT e.tenant_id, e.asset_id, e.metadata, a.storage_key
                FROM library_entries e
                JOIN assets a ON a.id = e.asset_id
                WHERE e.tenant_id = ?
                ORDER BY a.id
                """,
                (rs, rowNum) -> LibraryEntry.builder()
                        .tenantId(rs.getLong("tenant_id"))
                        .assetId(rs.getLong("asset_id"))
                        .storageKey(rs.getString("storage_key"))
                        .metadata(fromJson(rs.getString("metadata")))
                        .build(),
                tenantId
        );
    }

    @Override
    public boolean detach(long tenantId, String storageKey) {
        Optional<Asset> asset = contentRegistry.findByStorageKey(storageKey);
        if (asset.isEmpty()) {
            return false;
        }
        int removed = jdbcTemplate.update(
                "DELETE FROM library_entries WHERE tenant_id = ? AND asset_id = ?",
                tenantId,
                asset.get().getId()
        );
        if (removed > 0) {
            log.info("Tenant {} removed {} from library", tenantId, storageKey);
        }
        return removed > 0;
    }

    private int updateMetadata(long tenantId, long assetId, String json) {
        return jdbcTemplate.update(
                "UPDATE library_entries SET metadata = ? WHERE tenant_id = ? AND asset_id = ?",
                json,
                tenantId,
                assetId
        );
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Library metadata is not serializable: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable library metadata, returning empty map: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
