package com.github.stormino.medialib.model;

import com.github.stormino.medialib.exception.InvalidSourceException;
import lombok.EqualsAndHashCode;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical locator of an upstream asset, used as the dedup key.
 * Equivalent forms of the same video URL collapse to one canonical string.
 */
@EqualsAndHashCode
public final class SourceIdentity {

    private static final Pattern VIDEO_ID = Pattern.compile("[A-Za-z0-9_-]{11}");
    private static final Pattern WATCH_PARAM = Pattern.compile("(?:^|&)v=([A-Za-z0-9_-]{11})(?:&|$)");
    private static final Pattern PATH_ID = Pattern.compile("^/(?:shorts|embed|live|v)/([A-Za-z0-9_-]{11})(?:[/?].*)?$");
    private static final String CANONICAL_WATCH = "https://www.youtube.com/watch?v=";

    private final String value;

    private SourceIdentity(String value) {
        this.value = value;
    }

    /**
     * Validate and canonicalize a raw source string.
     *
     * @param raw Tenant-supplied URL
     * @param allowedHosts Hosts accepted as sources (case-insensitive)
     * @return Canonical identity
     * @throws InvalidSourceException if the input is not an allowed absolute http(s) URL
     */
    public static SourceIdentity parse(String raw, Collection<String> allowedHosts) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidSourceException("No URL provided", raw);
        }
        String trimmed = raw.trim();

        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            throw new InvalidSourceException("Malformed URL: " + e.getReason(), raw);
        }

        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : null;
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new InvalidSourceException("URL must be an absolute http(s) URL", raw);
        }
        String host = uri.getHost() != null ? uri.getHost().toLowerCase(Locale.ROOT) : null;
        if (host == null || host.isBlank()) {
            throw new InvalidSourceException("URL has no host", raw);
        }
        if (allowedHosts.stream().noneMatch(h -> h.equalsIgnoreCase(host))) {
            throw new InvalidSourceException("Unsupported source host: " + host, raw);
        }

        String videoId = extractVideoId(host, uri);
        if (videoId != null) {
            return new SourceIdentity(CANONICAL_WATCH + videoId);
        }
        if (isVideoHost(host)) {
            throw new InvalidSourceException("URL does not reference a single video", raw);
        }

        StringBuilder canonical = new StringBuilder(scheme).append("://").append(host);
        if (uri.getPort() != -1) {
            canonical.append(':').append(uri.getPort());
        }
        canonical.append(uri.getRawPath() != null ? uri.getRawPath() : "");
        if (uri.getRawQuery() != null) {
            canonical.append('?').append(uri.getRawQuery());
        }
        return new SourceIdentity(canonical.toString());
    }

    private static boolean isVideoHost(String host) {
        return host.equals("youtu.be") || host.equals("youtube.com") || host.endsWith(".youtube.com");
    }

    private static String extractVideoId(String host, URI uri) {
        if (!isVideoHost(host)) {
            return null;
        }
        String path = uri.getRawPath() != null ? uri.getRawPath() : "";
        if (host.equals("youtu.be")) {
            String candidate = path.startsWith("/") ? path.substring(1) : path;
            int slash = candidate.indexOf('/');
            if (slash >= 0) {
                candidate = candidate.substring(0, slash);
            }
            return VIDEO_ID.matcher(candidate).matches() ? candidate : null;
        }
        if (path.equals("/watch") && uri.getRawQuery() != null) {
            Matcher matcher = WATCH_PARAM.matcher(uri.getRawQuery());
            return matcher.find() ? matcher.group(1) : null;
        }
        Matcher matcher = PATH_ID.matcher(path);
        return matcher.matches() ? matcher.group(1) : null;
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
