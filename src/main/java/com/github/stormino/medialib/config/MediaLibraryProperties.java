package com.github.stormino.medialib.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "medialib")
public class MediaLibraryProperties {

    @Valid
    private Download download = new Download();

    @Valid
    private Source source = new Source();

    @Valid
    private Egress egress = new Egress();

    private Credentials credentials = new Credentials();

    private Storage storage = new Storage();

    @Data
    public static class Download {
        @NotBlank
        private String videosPath = "./videos";

        @NotBlank
        private String tempPath = "./videos/.tmp";

        @Min(1)
        private int parallelJobs = 3;

        @NotBlank
        private String toolPath = "yt-dlp";

        private String ffmpegLocation;

        @NotBlank
        private String format = "bestvideo[ext=mp4]+bestaudio[ext=m4a]/best[ext=mp4]/best";

        @NotBlank
        private String mergeOutputFormat = "mp4";

        @Min(1)
        private long attemptTimeoutMinutes = 60;

        @Min(0)
        private long artifactRecheckDelayMs = 1000;
    }

    @Data
    public static class Source {
        @NotEmpty
        private List<String> allowedHosts = new ArrayList<>(List.of(
                "youtube.com", "www.youtube.com", "m.youtube.com", "music.youtube.com", "youtu.be"));
    }

    @Data
    public static class Egress {
        @Valid
        private List<Route> routes = new ArrayList<>();

        @NotEmpty
        private List<String> clientIdentities = new ArrayList<>(List.of("web", "android", "ios", "tv_embedded"));

        @Min(1)
        @Max(12)
        private int maxRungs = 6;
    }

    /**
     * One configured network route. {@code supportsCredentials} is a documented
     * capability of the route, never tested at runtime.
     */
    @Data
    public static class Route {
        @NotBlank
        private String name;

        @NotBlank
        private String scheme = "direct";

        private String host;
        private Integer port;
        private String username;
        private String password;
        private boolean stickySession = false;
        private boolean supportsCredentials = true;
    }

    @Data
    public static class Credentials {
        private String defaultCookiesFile;

        public boolean hasDefaultCookiesFile() {
            return defaultCookiesFile != null && !defaultCookiesFile.isBlank();
        }
    }

    @Data
    public static class Storage {
        private boolean enabled = false;
        private String endpoint;
        private String region = "auto";
        private String bucket;
        private String accessKey;
        private String secretKey;
        private boolean pathStyleAccess = true;

        @Min(1)
        private long urlTtlSeconds = 3600;

        public boolean isConfigured() {
            return enabled
                    && bucket != null && !bucket.isBlank()
                    && accessKey != null && !accessKey.isBlank()
                    && secretKey != null && !secretKey.isBlank();
        }
    }
}
