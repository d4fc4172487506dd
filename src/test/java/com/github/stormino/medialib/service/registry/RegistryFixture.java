package com.github.stormino.medialib.service.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.stormino.medialib.config.MediaLibraryProperties;
import com.github.stormino.medialib.service.storage.ArtifactStore;
import com.github.stormino.medialib.service.storage.LocalBlobStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * In-memory H2 database with the production schema plus a local-only artifact store.
 */
public class RegistryFixture implements AutoCloseable {

    private final EmbeddedDatabase database;
    private final JdbcTemplate jdbcTemplate;
    private final DataSourceTransactionManager transactionManager;
    private final LocalBlobStore localStore;
    private final ArtifactStore artifactStore;
    private final TenantRepository tenantRepository;
    private final JdbcContentRegistry contentRegistry;
    private final JdbcTenantLibrary tenantLibrary;
    private final LibraryAdmission libraryAdmission;

    public RegistryFixture(Path storageRoot) {
        this.database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("classpath:schema.sql")
                .build();
        this.jdbcTemplate = new JdbcTemplate(database);
        this.transactionManager = new DataSourceTransactionManager(database);
        this.localStore = new LocalBlobStore(storageRoot);
        this.artifactStore = new ArtifactStore(localStore, Optional.empty(), new MediaLibraryProperties());
        this.tenantRepository = new TenantRepository(jdbcTemplate, transactionManager);
        this.contentRegistry = new JdbcContentRegistry(jdbcTemplate, transactionManager);
        this.tenantLibrary = new JdbcTenantLibrary(
                jdbcTemplate, contentRegistry, tenantRepository, artifactStore, new ObjectMapper(), transactionManager);
        this.libraryAdmission = new LibraryAdmission(contentRegistry, tenantLibrary, transactionManager);
    }

    /**
     * Write bytes for {@code storageKey} into the local store.
     */
    public Path writeArtifact(String storageKey, String content) throws IOException {
        Path path = localStore.pathFor(storageKey);
        Files.createDirectories(path.getParent());
        return Files.writeString(path, content);
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    public DataSourceTransactionManager transactionManager() {
        return transactionManager;
    }

    public LocalBlobStore localStore() {
        return localStore;
    }

    public ArtifactStore artifactStore() {
        return artifactStore;
    }

    public TenantRepository tenantRepository() {
        return tenantRepository;
    }

    public JdbcContentRegistry contentRegistry() {
        return contentRegistry;
    }

    public JdbcTenantLibrary tenantLibrary() {
        return tenantLibrary;
    }

    public LibraryAdmission libraryAdmission() {
        return libraryAdmission;
    }

    @Override
    public void close() {
        database.shutdown();
    }
}
