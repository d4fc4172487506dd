package com.github.stormino.medialib.service.credential;

import com.github.stormino.medialib.exception.InvalidCredentialException;
import com.github.stormino.medialib.util.AcquisitionConstants;
import org.springframework.stereotype.Component;

/**
 * Magic-header check for cookie-jar text.
 */
@Component
public class CookieJarValidator {

    public boolean isValid(String data) {
        if (data == null || data.isBlank()) {
            return false;
        }
        String firstLine = data.strip().lines().findFirst().orElse("").strip();
        return AcquisitionConstants.COOKIE_JAR_HEADERS.stream().anyMatch(firstLine::startsWith);
    }

    /**
     * @return {@code data} with surrounding blank space removed and a trailing newline
     * @throws InvalidCredentialException if the header is missing
     */
    public String requireValid(String data) {
        if (!isValid(data)) {
            throw new InvalidCredentialException(
                    "Invalid cookie file. Export cookies in Netscape format (first line: "
                            + AcquisitionConstants.COOKIE_JAR_HEADERS.get(0) + ")");
        }
        return data.strip() + "\n";
    }
}
