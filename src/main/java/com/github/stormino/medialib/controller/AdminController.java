package com.github.stormino.medialib.controller;

import com.github.stormino.medialib.service.registry.GarbageCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final GarbageCollector garbageCollector;

    /**
     * Delete every asset no tenant references, bytes included.
     */
    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, List<String>>> cleanup() {
        log.info("Running storage cleanup");
        return ResponseEntity.ok(Map.of("deleted", garbageCollector.collect()));
    }
}
