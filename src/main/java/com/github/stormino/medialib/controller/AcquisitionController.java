package com.github.stormino.medialib.controller;

import com.github.stormino.medialib.exception.InvalidSourceException;
import com.github.stormino.medialib.exception.RegistrationException;
import com.github.stormino.medialib.model.AcquisitionRequest;
import com.github.stormino.medialib.model.AcquisitionResult;
import com.github.stormino.medialib.model.JobStatus;
import com.github.stormino.medialib.service.job.AcquisitionService;
import com.github.stormino.medialib.util.AcquisitionConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestController
@RequestMapping("/api/download")
@RequiredArgsConstructor
public class AcquisitionController {

    private final AcquisitionService acquisitionService;

    /**
     * Request a source. 200 with the file on a dedup hit, 202 with a job id otherwise.
     */
    @PostMapping
    public ResponseEntity<AcquisitionResult> acquire(
            @RequestHeader(value = AcquisitionConstants.TENANT_HEADER, required = false) Long tenantId,
            @RequestBody AcquisitionRequest request) {

        long tenant = TenantHeader.require(tenantId);
        log.info("Tenant {} requested {}", tenant, request.getUrl());

        AcquisitionResult result;
        try {
            result = acquisitionService.acquire(tenant, request.getUrl(), request.getTitle(), request.getMetadata());
        } catch (InvalidSourceException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (RegistrationException e) {
            log.error("Could not attach existing asset for tenant {}: {}", tenant, e.getMessage());
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to save to library");
        }

        return result.isDedup()
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
    }

    /**
     * Poll a job. Jobs of other tenants are reported as not found.
     */
    @GetMapping("/{jobId}")
    public ResponseEntity<JobStatus> status(
            @RequestHeader(value = AcquisitionConstants.TENANT_HEADER, required = false) Long tenantId,
            @PathVariable String jobId) {

        long tenant = TenantHeader.require(tenantId);
        return acquisitionService.getJobStatus(tenant, jobId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found"));
    }
}
