package com.github.stormino.medialib.util;

import java.util.List;

/**
 * Constants used throughout the acquisition system.
 */
public final class AcquisitionConstants {

    private AcquisitionConstants() {
        // Utility class, no instantiation
    }

    // ========== Progress ==========

    /**
     * Progress shown while the tool merges or finalizes output.
     */
    public static final double FINALIZING_PROGRESS = 95.0;

    /**
     * Progress of a completed job.
     */
    public static final double COMPLETE_PROGRESS = 100.0;

    // ========== Tool Output ==========

    /**
     * Prefix of the line the tool prints with the title before downloading.
     */
    public static final String TITLE_MARKER = "[medialib-title]";

    /**
     * Number of trailing output lines kept for failure classification.
     */
    public static final int OUTPUT_TAIL_LINES = 200;

    /**
     * Exit code shells use for "command not found".
     */
    public static final int EXIT_COMMAND_NOT_FOUND = 127;

    /**
     * Exit code shells use for "found but not executable".
     */
    public static final int EXIT_NOT_EXECUTABLE = 126;

    // ========== Files ==========

    /**
     * Container extensions accepted as tool output besides the requested one.
     */
    public static final List<String> MEDIA_EXTENSIONS = List.of("mp4", "mkv", "webm", "m4a", "mov");

    /**
     * Suffix of the per-attempt credential file handed to the tool.
     */
    public static final String COOKIE_FILE_SUFFIX = ".cookies.txt";

    // ========== Credentials ==========

    /**
     * Accepted first lines of a cookie-jar file.
     */
    public static final List<String> COOKIE_JAR_HEADERS = List.of(
            "# Netscape HTTP Cookie File",
            "# HTTP Cookie File");

    // ========== Errors ==========

    public static final String ARTIFACT_MISSING_ERROR = "Artifact missing after reported success";

    public static final String LADDER_EXHAUSTED_PREFIX = "All acquisition strategies failed: ";

    // ========== HTTP ==========

    /**
     * Header carrying the caller's tenant id.
     */
    public static final String TENANT_HEADER = "X-Tenant-Id";

    // ========== Library Metadata ==========

    public static final String METADATA_TITLE = "title";

    public static final String METADATA_URL = "url";
}
