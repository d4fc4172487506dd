package com.github.stormino.medialib.controller;

import com.github.stormino.medialib.exception.RegistrationException;
import com.github.stormino.medialib.exception.StorageException;
import com.github.stormino.medialib.model.Asset;
import com.github.stormino.medialib.service.registry.LibraryService;
import com.github.stormino.medialib.service.registry.TenantLibrary;
import com.github.stormino.medialib.util.AcquisitionConstants;
import com.github.stormino.medialib.util.PathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class LibraryController {

    private final TenantLibrary tenantLibrary;
    private final LibraryService libraryService;

    @GetMapping("/library")
    public ResponseEntity<Map<String, Map<String, Object>>> list(
            @RequestHeader(value = AcquisitionConstants.TENANT_HEADER, required = false) Long tenantId) {
        return ResponseEntity.ok(tenantLibrary.list(TenantHeader.require(tenantId)));
    }

    @PutMapping("/library/{filename}")
    public ResponseEntity<Map<String, Object>> save(
            @RequestHeader(value = AcquisitionConstants.TENANT_HEADER, required = false) Long tenantId,
            @PathVariable String filename,
            @RequestBody(required = false) Map<String, Object> metadata) {

        long tenant = TenantHeader.require(tenantId);
        requireSafe(filename);
        Asset asset;
        try {
            asset = libraryService.save(tenant, filename, metadata)
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "File not found"));
        } catch (RegistrationException e) {
            log.error("Save failed for tenant {}: {}", tenant, e.getMessage());
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to save to library");
        }
        return ResponseEntity.ok(Map.of("filename", asset.getStorageKey(), "saved", true));
    }

    @DeleteMapping("/library/{filename}")
    public ResponseEntity<Map<String, Object>> remove(
            @RequestHeader(value = AcquisitionConstants.TENANT_HEADER, required = false) Long tenantId,
            @PathVariable String filename) {

        long tenant = TenantHeader.require(tenantId);
        requireSafe(filename);
        if (!tenantLibrary.detach(tenant, filename)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Not in library");
        }
        return ResponseEntity.ok(Map.of("filename", filename, "removed", true));
    }

    @PostMapping("/videos/upload")
    public ResponseEntity<Map<String, Object>> upload(
            @RequestHeader(value = AcquisitionConstants.TENANT_HEADER, required = false) Long tenantId,
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "title", required = false) String title) {

        long tenant = TenantHeader.require(tenantId);
        if (file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Empty upload");
        }
        try (InputStream content = file.getInputStream()) {
            Asset asset = libraryService.upload(tenant, file.getOriginalFilename(), content, title);
            return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                    "filename", asset.getStorageKey(),
                    "title", asset.getDisplayTitle()));
        } catch (IOException | StorageException | RegistrationException e) {
            log.error("Upload failed for tenant {}: {}", tenant, e.getMessage());
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Upload failed");
        }
    }

    private static void requireSafe(String filename) {
        if (!PathUtils.isSafeStorageKey(filename)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid filename");
        }
    }
}
