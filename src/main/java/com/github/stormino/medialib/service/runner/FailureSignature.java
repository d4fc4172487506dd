package com.github.stormino.medialib.service.runner;

import com.github.stormino.medialib.model.FailureKind;

import java.util.regex.Pattern;

/**
 * Known failure messages of the extraction tool, in match priority order.
 */
public enum FailureSignature {

    INVALID_URL(FailureKind.INVALID_SOURCE,
            "is not a valid URL|Unsupported URL|Incomplete YouTube ID|Invalid URL"),

    CONTENT_UNAVAILABLE(FailureKind.CONTENT_UNAVAILABLE,
            "Video unavailable|Private video|This video has been removed|This video is no longer available"
                    + "|members[- ]only|This live event will begin"),

    BOT_CHECK(FailureKind.UPSTREAM_BLOCKED,
            "Sign in to confirm you.?re not a bot|confirm you are not a robot"),

    RATE_LIMITED(FailureKind.UPSTREAM_BLOCKED,
            "HTTP Error 429|Too Many Requests|rate[- ]limit"),

    NETWORK_BLOCKED(FailureKind.UPSTREAM_BLOCKED,
            "has blocked your (?:IP|network)|unusual traffic"),

    LOGIN_REQUIRED(FailureKind.UPSTREAM_BLOCKED,
            "Sign in to confirm your age|cookies are no longer valid|requires authentication"),

    CLIENT_NOT_SUPPORTED(FailureKind.CLIENT_BLOCKED,
            "not available on this app|PO Token|player response is not available"),

    FORMAT_UNAVAILABLE(FailureKind.CLIENT_BLOCKED,
            "Requested format is not available|No video formats found"),

    FORBIDDEN(FailureKind.CLIENT_BLOCKED,
            "HTTP Error 403|403: Forbidden"),

    CONNECTIVITY(FailureKind.CONNECTIVITY,
            "Unable to connect to proxy|ProxyError|Tunnel connection failed|Connection refused|Connection reset"
                    + "|timed out|Temporary failure in name resolution|Name or service not known"
                    + "|Network is unreachable|Unable to download (?:webpage|API page)|EOF occurred in violation");

    private final FailureKind kind;
    private final Pattern pattern;

    FailureSignature(FailureKind kind, String regex) {
        this.kind = kind;
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    public FailureKind getKind() {
        return kind;
    }

    public boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }
}
