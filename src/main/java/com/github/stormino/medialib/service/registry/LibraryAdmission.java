package com.github.stormino.medialib.service.registry;

import com.github.stormino.medialib.exception.RegistrationException;
import com.github.stormino.medialib.model.Asset;
import com.github.stormino.medialib.model.AssetRegistration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Puts assets into tenant libraries without ever exposing a zero-reference row to the
 * garbage collector.
 *
 * <p>The asset row is locked for the whole unit. The collector locks the same row before
 * its conditional delete, so it either finishes first (the lock comes back empty and the
 * bytes are registered again) or waits and then sees the new library entry. A freshly
 * inserted row is invisible to the collector until the entry commits with it.
 *
 * <p>The attach runs in a savepoint: if it fails, the registration still commits and
 * the bytes stay available for the next request.
 */
@Slf4j
@Service
public class LibraryAdmission {

    private static final int MAX_REGISTER_ATTEMPTS = 3;

    private final ContentRegistry contentRegistry;
    private final TenantLibrary tenantLibrary;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate attachTemplate;

    public LibraryAdmission(ContentRegistry contentRegistry,
                            TenantLibrary tenantLibrary,
                            PlatformTransactionManager transactionManager) {
        this.contentRegistry = contentRegistry;
        this.tenantLibrary = tenantLibrary;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.attachTemplate = new TransactionTemplate(transactionManager);
        this.attachTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    /**
     * Register the bytes (or resolve to the canonical asset for them) and attach the result
     * to the tenant's library.
     *
     * @param tenantId Owning tenant
     * @param registration Bytes to register
     * @param metadata Library metadata for the tenant
     * @param beforeAttach Runs with the locked canonical asset before the attach; an exception
     *                     here rolls the whole unit back
     * @return The canonical asset
     * @throws RegistrationException if registration or the attach failed; after a failed attach
     *                               the asset stays registered
     */
    public Asset registerAndAttach(long tenantId, AssetRegistration registration,
                                   Map<String, Object> metadata, Consumer<Asset> beforeAttach) {
        AtomicReference<RegistrationException> attachFailure = new AtomicReference<>();

        Asset asset = transactionTemplate.execute(status -> {
            Asset locked = registerLocked(registration);
            beforeAttach.accept(locked);
            try {
                attachTemplate.executeWithoutResult(
                        nested -> tenantLibrary.attach(tenantId, locked.getId(), metadata));
            } catch (RegistrationException e) {
                attachFailure.set(e);
            }
            return locked;
        });

        if (attachFailure.get() != null) {
            log.warn("Asset {} registered but not attached for tenant {}: {}",
                    asset.getId(), tenantId, attachFailure.get().getMessage());
            throw attachFailure.get();
        }
        return asset;
    }

    /**
     * Attach an already registered asset, unless it was collected in the meantime.
     *
     * @return The asset, empty if its row no longer exists
     */
    public Optional<Asset> attachIfPresent(long tenantId, long assetId, Map<String, Object> metadata) {
        return transactionTemplate.execute(status -> {
            Optional<Asset> locked = contentRegistry.lockById(assetId);
            locked.ifPresent(asset -> tenantLibrary.attach(tenantId, asset.getId(), metadata));
            return locked;
        });
    }

    private Asset registerLocked(AssetRegistration registration) {
        for (int attempt = 1; attempt <= MAX_REGISTER_ATTEMPTS; attempt++) {
            Asset asset = contentRegistry.register(registration.getStorageKey(), registration.getSourceIdentity(),
                    registration.getTitle(), registration.getByteSize());
            Optional<Asset> locked = contentRegistry.lockById(asset.getId());
            if (locked.isPresent()) {
                return locked.get();
            }
            log.debug("Asset {} collected before it could be locked, registering {} again",
                    asset.getId(), registration.getStorageKey());
        }
        throw new RegistrationException("Asset kept disappearing during registration",
                registration.getStorageKey(), null);
    }
}
