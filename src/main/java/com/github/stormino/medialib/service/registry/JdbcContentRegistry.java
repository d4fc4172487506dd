package com.github.stormino.medialib.service.registry;

import com.github.stormino.medialib.exception.RegistrationException;
import com.github.stormino.medialib.model.Asset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Repository
public class JdbcContentRegistry implements ContentRegistry {

    private static final String ASSET_COLUMNS =
            "id, source_identity, display_title, storage_key, byte_size, created_at";

    private static final RowMapper<Asset> ASSET_MAPPER = (rs, rowNum) -> {
        Timestamp created = rs.getTimestamp("created_at");
        long size = rs.getLong("byte_size");
        return Asset.builder()
                .id(rs.getLong("id"))
                .sourceIdentity(rs.getString("source_identity"))
                .displayTitle(rs.getString("display_title"))
                .storageKey(rs.getString("storage_key"))
                .byteSize(rs.wasNull() ? null : size)
                .createdAt(created == null ? null : created.toLocalDateTime())
                .build();
    };

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate insertTemplate;

    public JdbcContentRegistry(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        // Savepoint inside a caller's transaction, so a lost insert race leaves it usable
        this.insertTemplate = new TransactionTemplate(transactionManager);
        this.insertTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    @Override
    public Optional<Asset> findBySource(String sourceIdentity) {
        if (sourceIdentity == null) {
            return Optional.empty();
        }
        return jdbcTemplate.query(
                "SELECT " + ASSET_COLUMNS + " FROM assets WHERE source_identity = ?",
                ASSET_MAPPER,
                sourceIdentity
        ).stream().findFirst();
    }

    @Override
    public Optional<Asset> findByStorageKey(String storageKey) {
        return jdbcTemplate.query(
                "SELECT " + ASSET_COLUMNS + " FROM assets WHERE storage_key = ?",
                ASSET_MAPPER,
                storageKey
        ).stream().findFirst();
    }

    @Override
    public Optional<Asset> lockById(long assetId) {
        return jdbcTemplate.query(
                "SELECT " + ASSET_COLUMNS + " FROM assets WHERE id = ? FOR UPDATE",
                ASSET_MAPPER,
                assetId
        ).stream().findFirst();
    }

    @Override
    public Asset register(String storageKey, String sourceIdentity, String title, Long byteSize) {
        Optional<Asset> existing = findExisting(storageKey, sourceIdentity);
        if (existing.isPresent()) {
            log.debug("Asset already registered for key={} source={}: id={}",
                    storageKey, sourceIdentity, existing.get().getId());
            return existing.get();
        }

        try {
            insertTemplate.executeWithoutResult(status -> jdbcTemplate.update(
                    "INSERT INTO assets (source_identity, display_title, storage_key, byte_size, created_at) "
                            + "VALUES (?, ?, ?, ?, ?)",
                    sourceIdentity,
                    title,
                    storageKey,
                    byteSize,
                    Timestamp.valueOf(LocalDateTime.now())
            ));
        } catch (DuplicateKeyException e) {
            // Lost a race with a concurrent registration; the winner's row is canonical
            log.debug("Concurrent registration for key={} source={}, reading canonical row", storageKey, sourceIdentity);
            return findExisting(storageKey, sourceIdentity)
                    .orElseThrow(() -> new RegistrationException(
                            "Registration conflict could not be resolved", storageKey, e));
        } catch (DataAccessException e) {
            throw new RegistrationException("Failed to register asset: " + e.getMessage(), storageKey, e);
        }

        Asset asset = findByStorageKey(storageKey)
                .orElseThrow(() -> new RegistrationException("Registered asset not readable", storageKey, null));
        log.info("Registered asset id={} key={} source={}", asset.getId(), storageKey, sourceIdentity);
        return asset;
    }

    @Override
    public int referenceCount(long assetId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM library_entries WHERE asset_id = ?",
                Integer.class,
                assetId
        );
        return count == null ? 0 : count;
    }

    @Override
    public void updateByteSize(long assetId, long byteSize) {
        jdbcTemplate.update("UPDATE assets SET byte_size = ? WHERE id = ?", byteSize, assetId);
    }

    @Override
    public void delete(long assetId) {
        jdbcTemplate.update("DELETE FROM assets WHERE id = ?", assetId);
        log.debug("Deleted asset id={}", assetId);
    }

    @Override
    public boolean deleteIfUnreferenced(long assetId) {
        int deleted = jdbcTemplate.update(
                "DELETE FROM assets WHERE id = ? "
                        + "AND NOT EXISTS (SELECT 1 FROM library_entries e WHERE e.asset_id = ?)",
                assetId,
                assetId
        );
        return deleted > 0;
    }

    @Override
    public List<Asset> findUnreferenced() {
        return jdbcTemplate.query(
                "SELECT " + ASSET_COLUMNS + " FROM assets a "
                        + "WHERE NOT EXISTS (SELECT 1 FROM library_entries e WHERE e.asset_id = a.id) "
                        + "ORDER BY a.id",
                ASSET_MAPPER
        );
    }

    private Optional<Asset> findExisting(String storageKey, String sourceIdentity) {
        Optional<Asset> byKey = findByStorageKey(storageKey);
        return byKey.isPresent() ? byKey : findBySource(sourceIdentity);
    }
}
