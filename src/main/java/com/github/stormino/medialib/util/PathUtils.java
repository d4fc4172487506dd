package com.github.stormino.medialib.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Utility class for storage keys and artifact paths.
 */
@Slf4j
@UtilityClass
public class PathUtils {

    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,254}");
    private static final int MAX_NAME_LENGTH = 200;

    /**
     * Check that a storage key is a plain file name that cannot escape the storage directory.
     *
     * @param key Candidate storage key
     * @return true if the key is safe to resolve against the storage directory
     */
    public static boolean isSafeStorageKey(String key) {
        return key != null && SAFE_KEY.matcher(key).matches() && !key.contains("..");
    }

    /**
     * Sanitize an uploaded file name into a storage key.
     *
     * @param filename Original filename
     * @return Sanitized key, "unnamed" if nothing usable remains
     */
    public static String sanitizeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            return "unnamed";
        }
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);

        String sanitized = name
                .replaceAll("\\s+", ".")
                .replaceAll("[^A-Za-z0-9._-]", "")
                .replaceAll("\\.{2,}", ".");
        if (sanitized.length() > MAX_NAME_LENGTH) {
            // Keep the tail so the extension survives
            sanitized = sanitized.substring(sanitized.length() - MAX_NAME_LENGTH);
        }
        sanitized = sanitized.replaceAll("^[._-]+", "");
        return sanitized.isEmpty() ? "unnamed" : sanitized;
    }

    public static String getFilenameWithoutExtension(String filename) {
        if (filename == null || filename.isBlank()) {
            return "";
        }
        int lastDot = filename.lastIndexOf('.');
        return lastDot > 0 ? filename.substring(0, lastDot) : filename;
    }

    /**
     * Find the file the tool produced for {@code expected}. Accepts the exact path or,
     * failing that, the same stem with another known media extension. Empty files do not count.
     *
     * @param expected Path the tool was asked to write
     * @return The produced file, if any
     */
    public static Optional<Path> locateArtifact(Path expected) {
        if (isNonEmptyFile(expected)) {
            return Optional.of(expected);
        }
        Path directory = expected.toAbsolutePath().getParent();
        String stem = getFilenameWithoutExtension(expected.getFileName().toString());
        for (String extension : AcquisitionConstants.MEDIA_EXTENSIONS) {
            Path candidate = directory.resolve(stem + "." + extension);
            if (isNonEmptyFile(candidate)) {
                log.debug("Artifact found under alternate extension: {}", candidate);
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static boolean isNonEmptyFile(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            log.debug("Could not stat {}: {}", path, e.getMessage());
            return false;
        }
    }
}
