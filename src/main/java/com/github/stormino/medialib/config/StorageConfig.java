package com.github.stormino.medialib.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

/**
 * S3-compatible clients for the remote blob store. Only created when
 * {@code medialib.storage.enabled=true}; otherwise artifacts live on the local
 * filesystem alone.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "medialib.storage", name = "enabled", havingValue = "true")
public class StorageConfig {

    private final MediaLibraryProperties properties;

    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        MediaLibraryProperties.Storage storage = requireConfigured();
        S3Client client = S3Client.builder()
                .credentialsProvider(credentialsProvider(storage))
                .region(Region.of(storage.getRegion()))
                .endpointOverride(URI.create(storage.getEndpoint()))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(storage.isPathStyleAccess())
                        .build())
                .build();
        log.info("Remote blob store initialized: bucket={}, endpoint={}", storage.getBucket(), storage.getEndpoint());
        return client;
    }

    @Bean(destroyMethod = "close")
    public S3Presigner s3Presigner() {
        MediaLibraryProperties.Storage storage = requireConfigured();
        return S3Presigner.builder()
                .credentialsProvider(credentialsProvider(storage))
                .region(Region.of(storage.getRegion()))
                .endpointOverride(URI.create(storage.getEndpoint()))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(storage.isPathStyleAccess())
                        .build())
                .build();
    }

    private MediaLibraryProperties.Storage requireConfigured() {
        MediaLibraryProperties.Storage storage = properties.getStorage();
        if (!storage.isConfigured()) {
            throw new IllegalStateException(
                    "Remote storage is enabled but medialib.storage.bucket, access-key or secret-key is missing");
        }
        return storage;
    }

    private static StaticCredentialsProvider credentialsProvider(MediaLibraryProperties.Storage storage) {
        return StaticCredentialsProvider.create(
                AwsBasicCredentials.create(storage.getAccessKey(), storage.getSecretKey()));
    }
}
