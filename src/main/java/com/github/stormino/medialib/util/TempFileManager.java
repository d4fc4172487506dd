package com.github.stormino.medialib.util;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns the scratch files of one acquisition job (credential copies handed to the
 * tool) and deletes them on close. Use with try-with-resources around the job.
 */
@Slf4j
public class TempFileManager implements Closeable {

    private final List<Path> tempFiles = new CopyOnWriteArrayList<>();
    private volatile boolean closed = false;

    /**
     * Write {@code content} to a new file in {@code directory} readable only by the owner
     * where the filesystem allows it, and register it for cleanup.
     *
     * @param directory Scratch directory, created if missing
     * @param prefix File name prefix
     * @param suffix File name suffix
     * @param content Text to write
     * @return Path of the written file
     * @throws IOException if the file cannot be created or written
     * @throws IllegalStateException if the manager is already closed
     */
    public Path writeTempFile(Path directory, String prefix, String suffix, String content) throws IOException {
        if (closed) {
            throw new IllegalStateException("TempFileManager is already closed");
        }
        Files.createDirectories(directory);
        Path file = Files.createTempFile(directory, prefix, suffix);
        restrictPermissions(file);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        tempFiles.add(file);
        log.debug("Created temp file: {}", file);
        return file;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        log.debug("Cleaning up {} temp files", tempFiles.size());
        for (Path file : new ArrayList<>(tempFiles)) {
            deleteFile(file);
        }
        tempFiles.clear();
    }

    private static void restrictPermissions(Path file) {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException | IOException e) {
            log.debug("Could not restrict permissions on {}: {}", file, e.getMessage());
        }
    }

    private static void deleteFile(Path file) {
        try {
            if (Files.deleteIfExists(file)) {
                log.debug("Deleted temp file: {}", file);
            }
        } catch (IOException e) {
            log.warn("Failed to delete temp file: {}", file, e);
        }
    }
}
