package com.github.stormino.medialib.service.egress;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Client the extraction tool impersonates when talking to the upstream site.
 * Only some clients accept session cookies; the others are used credential-less.
 */
public enum ClientIdentity {
    WEB("web", true),
    WEB_SAFARI("web_safari", true),
    MWEB("mweb", true),
    TV("tv", true),
    TV_EMBEDDED("tv_embedded", true),
    ANDROID("android", false),
    IOS("ios", false);

    private final String toolName;
    private final boolean supportsCredentials;

    ClientIdentity(String toolName, boolean supportsCredentials) {
        this.toolName = toolName;
        this.supportsCredentials = supportsCredentials;
    }

    /**
     * Name passed to the tool's {@code player_client} extractor argument.
     */
    public String getToolName() {
        return toolName;
    }

    public boolean supportsCredentials() {
        return supportsCredentials;
    }

    public static Optional<ClientIdentity> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(identity -> identity.toolName.equals(normalized))
                .findFirst();
    }
}
