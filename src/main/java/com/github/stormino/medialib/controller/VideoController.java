package com.github.stormino.medialib.controller;

import com.github.stormino.medialib.service.storage.ArtifactStore;
import com.github.stormino.medialib.util.PathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Serves artifact bytes: a redirect to remote storage when it holds them, the local file otherwise.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class VideoController {

    private final ArtifactStore artifactStore;

    @GetMapping("/videos/{filename}")
    public ResponseEntity<Resource> serve(@PathVariable String filename) {
        if (!PathUtils.isSafeStorageKey(filename)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "File not found");
        }

        Optional<String> remoteUrl = artifactStore.urlFor(filename);
        if (remoteUrl.isPresent()) {
            return ResponseEntity.status(HttpStatus.FOUND)
                    .header(HttpHeaders.LOCATION, remoteUrl.get())
                    .build();
        }

        Path local = artifactStore.localPath(filename)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "File not found"));
        MediaType contentType = MediaTypeFactory.getMediaType(filename).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok()
                .contentType(contentType)
                .body(new FileSystemResource(local));
    }
}
