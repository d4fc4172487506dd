package com.github.stormino.medialib.service.parser;

import com.github.stormino.medialib.model.ProgressUpdate;

/**
 * Interface for parsing progress information from command output.
 * Allows for different implementations for various extraction tools.
 */
public interface ProgressParser {

    /**
     * Parse a single line of output and extract progress information.
     *
     * @param line Output line to parse
     * @param jobId Job ID for the progress update
     * @return ProgressUpdate if progress or a title was found, null otherwise
     */
    ProgressUpdate parseLine(String line, String jobId);

    /**
     * Get the title reported by the tool, if any.
     *
     * @return Title, or null if the tool has not printed one
     */
    String getTitle();
}
