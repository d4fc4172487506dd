package com.github.stormino.medialib.service.command;

import com.github.stormino.medialib.config.MediaLibraryProperties;
import com.github.stormino.medialib.service.runner.AttemptRequest;
import com.github.stormino.medialib.util.AcquisitionConstants;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder for the extraction tool's command-line arguments.
 * Centralizes command construction so rungs differ only in route, client and credential.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractionCommandBuilder {

    private static final String PROXY_PLACEHOLDER = "<proxy>";

    private final MediaLibraryProperties properties;

    /**
     * Build the command for one rung.
     *
     * @param request Attempt to run
     * @return Tool arguments, executable first
     */
    public List<String> buildAcquisitionCommand(@NonNull AttemptRequest request) {
        MediaLibraryProperties.Download download = properties.getDownload();

        List<String> command = new ArrayList<>();
        command.add(download.getToolPath());

        if (download.getFfmpegLocation() != null && !download.getFfmpegLocation().isBlank()) {
            command.add("--ffmpeg-location");
            command.add(download.getFfmpegLocation());
        }

        command.add("-f");
        command.add(download.getFormat());
        command.add("--merge-output-format");
        command.add(download.getMergeOutputFormat());
        command.add("-o");
        command.add(request.getOutputFile().toString());
        command.add("--no-playlist");
        command.add("--newline");
        command.add("--progress");
        command.add("--no-simulate");
        command.add("--print");
        command.add("before_dl:" + AcquisitionConstants.TITLE_MARKER + " %(title)s");

        String proxy = request.getAttempt().getRoute().toProxyUrl();
        if (proxy != null) {
            command.add("--proxy");
            command.add(proxy);
        }

        command.add("--extractor-args");
        command.add("youtube:player_client=" + request.getAttempt().getClientIdentity().getToolName());

        if (request.getAttempt().isUseCredential() && request.getCredentialFile() != null) {
            command.add("--cookies");
            command.add(request.getCredentialFile().toString());
        }

        command.add(request.getSourceIdentity());

        if (log.isDebugEnabled()) {
            log.debug("Built acquisition command: {}", String.join(" ", redact(command, proxy)));
        }
        return command;
    }

    /**
     * Version command used by the health check.
     */
    public List<String> buildVersionCommand() {
        return List.of(properties.getDownload().getToolPath(), "--version");
    }

    private static List<String> redact(List<String> command, String proxy) {
        if (proxy == null) {
            return command;
        }
        return command.stream()
                .map(arg -> arg.equals(proxy) ? PROXY_PLACEHOLDER : arg)
                .toList();
    }
}
