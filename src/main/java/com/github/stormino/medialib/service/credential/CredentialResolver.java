package com.github.stormino.medialib.service.credential;

import com.github.stormino.medialib.config.MediaLibraryProperties;
import com.github.stormino.medialib.util.AcquisitionConstants;
import com.github.stormino.medialib.util.TempFileManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Picks the credential a job runs with: the tenant's own, else the process-wide default file.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialResolver {

    private final CredentialStore credentialStore;
    private final CookieJarValidator validator;
    private final MediaLibraryProperties properties;

    public Optional<String> resolve(long tenantId) {
        Optional<String> tenantCredential = credentialStore.get(tenantId)
                .filter(validator::isValid);
        if (tenantCredential.isPresent()) {
            log.debug("Using stored credential of tenant {}", tenantId);
            return tenantCredential;
        }
        return readDefault();
    }

    /**
     * Copy the credential into a scratch file owned by {@code tempFiles}, so the
     * tool can read it and it disappears with the job.
     *
     * @throws IOException if the file cannot be written
     */
    public Path writeCredentialFile(String credential, String jobId, TempFileManager tempFiles) throws IOException {
        Path directory = Paths.get(properties.getDownload().getTempPath());
        return tempFiles.writeTempFile(directory, jobId + "-", AcquisitionConstants.COOKIE_FILE_SUFFIX, credential);
    }

    private Optional<String> readDefault() {
        MediaLibraryProperties.Credentials credentials = properties.getCredentials();
        if (!credentials.hasDefaultCookiesFile()) {
            return Optional.empty();
        }
        Path file = Paths.get(credentials.getDefaultCookiesFile());
        if (!Files.isReadable(file)) {
            log.warn("Default cookies file {} is not readable", file);
            return Optional.empty();
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            if (!validator.isValid(content)) {
                log.warn("Default cookies file {} is not in cookie-jar format, ignoring it", file);
                return Optional.empty();
            }
            return Optional.of(content);
        } catch (IOException e) {
            log.warn("Failed to read default cookies file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
