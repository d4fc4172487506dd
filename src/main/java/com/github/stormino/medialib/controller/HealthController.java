package com.github.stormino.medialib.controller;

import com.github.stormino.medialib.service.runner.AcquisitionRunner;
import com.github.stormino.medialib.service.storage.ArtifactStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

    private final AcquisitionRunner runner;
    private final ArtifactStore artifactStore;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Optional<String> version = runner.toolVersion();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("toolAvailable", version.isPresent());
        body.put("toolVersion", version.orElse(null));
        body.put("remoteStorage", artifactStore.isRemoteEnabled());
        return ResponseEntity.ok(body);
    }
}
