package com.github.stormino.medialib.service.egress;

import com.github.stormino.medialib.config.MediaLibraryProperties;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Network egress route for one acquisition attempt. Immutable; every variant
 * (new session, other protocol, other port) is derived through a pure transform.
 */
@Value
@Builder(toBuilder = true)
public class RouteDescriptor {

    private static final String SESSION_SEPARATOR = "-session-";

    @NonNull
    String name;

    @NonNull
    @Builder.Default
    RouteScheme scheme = RouteScheme.DIRECT;

    String host;
    Integer port;
    String username;
    String password;

    /**
     * Sticky-session tag appended to the proxy username, selecting one exit IP.
     */
    String sessionTag;

    boolean stickySession;

    /**
     * Documented capability: whether session cookies may be sent over this route.
     */
    @Builder.Default
    boolean supportsCredentials = true;

    public static RouteDescriptor direct() {
        return RouteDescriptor.builder()
                .name("direct")
                .scheme(RouteScheme.DIRECT)
                .supportsCredentials(true)
                .build();
    }

    public static RouteDescriptor fromConfig(MediaLibraryProperties.Route route) {
        RouteScheme scheme = RouteScheme.parse(route.getScheme());
        if (scheme != RouteScheme.DIRECT && (route.getHost() == null || route.getHost().isBlank())) {
            throw new IllegalArgumentException("Route '" + route.getName() + "' needs a host for scheme " + scheme);
        }
        return RouteDescriptor.builder()
                .name(route.getName())
                .scheme(scheme)
                .host(route.getHost())
                .port(route.getPort())
                .username(route.getUsername())
                .password(route.getPassword())
                .stickySession(route.isStickySession())
                .supportsCredentials(route.isSupportsCredentials())
                .build();
    }

    public boolean isDirect() {
        return scheme == RouteScheme.DIRECT;
    }

    public RouteDescriptor withSessionTag(String tag) {
        return toBuilder().sessionTag(tag).build();
    }

    public RouteDescriptor withoutSession() {
        return toBuilder().sessionTag(null).build();
    }

    public RouteDescriptor withScheme(RouteScheme newScheme) {
        return toBuilder().scheme(newScheme).build();
    }

    public RouteDescriptor withPort(int newPort) {
        return toBuilder().port(newPort).build();
    }

    public int effectivePort() {
        return port != null ? port : scheme.getDefaultPort();
    }

    /**
     * Username as presented to the proxy, carrying the session tag when there is one.
     */
    public String effectiveUsername() {
        if (username == null) {
            return null;
        }
        return sessionTag != null ? username + SESSION_SEPARATOR + sessionTag : username;
    }

    /**
     * Proxy URL for the tool's {@code --proxy} option, or null for a direct route.
     */
    public String toProxyUrl() {
        if (isDirect()) {
            return null;
        }
        StringBuilder url = new StringBuilder(scheme.getProtocol()).append("://");
        String user = effectiveUsername();
        if (user != null) {
            url.append(encode(user));
            if (password != null) {
                url.append(':').append(encode(password));
            }
            url.append('@');
        }
        url.append(host).append(':').append(effectivePort());
        return url.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        if (isDirect()) {
            return name + "(direct)";
        }
        return name + "(" + scheme.getProtocol() + "://" + host + ":" + effectivePort()
                + (sessionTag != null ? " session=" + sessionTag : "") + ")";
    }
}
