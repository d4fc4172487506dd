package com.github.stormino.medialib.service.parser;

import com.github.stormino.medialib.model.ProgressUpdate;
import com.github.stormino.medialib.util.AcquisitionConstants;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the extraction tool's line-oriented output.
 * Progress never decreases, stays below the finalizing mark while downloading,
 * and is pinned at the finalizing mark once merging starts.
 */
@Slf4j
public class ToolOutputParser implements ProgressParser {

    private static final Pattern PERCENT_PATTERN = Pattern.compile("(\\d{1,3}(?:\\.\\d+)?)%");
    private static final String DOWNLOAD_PREFIX = "[download]";

    private static final List<String> FINALIZE_MARKERS = List.of(
            "[Merger]",
            "Merging formats into",
            "[FixupM3u8]",
            "[FixupM4a]",
            "[VideoRemuxer]",
            "[VideoConvertor]");

    private String title;
    private double progress = 0.0;
    private boolean finalizing = false;

    @Override
    public ProgressUpdate parseLine(String line, String jobId) {
        if (line == null || line.isBlank()) {
            return null;
        }
        String trimmed = line.trim();

        if (trimmed.startsWith(AcquisitionConstants.TITLE_MARKER)) {
            String value = trimmed.substring(AcquisitionConstants.TITLE_MARKER.length()).trim();
            if (!value.isEmpty() && !"NA".equals(value)) {
                title = value;
                log.debug("Discovered title: {}", title);
                return ProgressUpdate.builder()
                        .jobId(jobId)
                        .title(title)
                        .phase(currentPhase())
                        .build();
            }
            return null;
        }

        if (isFinalizeMarker(trimmed)) {
            finalizing = true;
            progress = Math.max(progress, AcquisitionConstants.FINALIZING_PROGRESS);
            return ProgressUpdate.builder()
                    .jobId(jobId)
                    .progress(progress)
                    .phase(ProgressUpdate.Phase.FINALIZING)
                    .build();
        }

        if (!finalizing && trimmed.startsWith(DOWNLOAD_PREFIX)) {
            Matcher matcher = PERCENT_PATTERN.matcher(trimmed);
            if (matcher.find()) {
                double value = parsePercent(matcher.group(1));
                double capped = Math.min(value, AcquisitionConstants.FINALIZING_PROGRESS);
                if (capped > progress) {
                    progress = capped;
                }
                return ProgressUpdate.builder()
                        .jobId(jobId)
                        .progress(progress)
                        .phase(ProgressUpdate.Phase.DOWNLOADING)
                        .build();
            }
        }

        return null;
    }

    @Override
    public String getTitle() {
        return title;
    }

    private ProgressUpdate.Phase currentPhase() {
        return finalizing ? ProgressUpdate.Phase.FINALIZING : ProgressUpdate.Phase.DOWNLOADING;
    }

    private static boolean isFinalizeMarker(String line) {
        return FINALIZE_MARKERS.stream().anyMatch(line::startsWith);
    }

    private static double parsePercent(String value) {
        try {
            return Math.max(0.0, Math.min(100.0, Double.parseDouble(value)));
        } catch (NumberFormatException e) {
            log.warn("Failed to parse percentage: {}", value);
            return 0.0;
        }
    }
}
