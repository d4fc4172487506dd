package com.github.stormino.medialib.service.storage;

import com.github.stormino.medialib.config.MediaLibraryProperties;
import com.github.stormino.medialib.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * S3-compatible remote store for artifacts.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "medialib.storage", name = "enabled", havingValue = "true")
public class S3BlobStore implements BlobStore {

    private static final String CONTENT_TYPE = "video/mp4";

    private final S3Client s3Client;
    private final S3Presigner presigner;
    private final String bucket;

    public S3BlobStore(S3Client s3Client, S3Presigner presigner, MediaLibraryProperties properties) {
        this.s3Client = s3Client;
        this.presigner = presigner;
        this.bucket = properties.getStorage().getBucket();
    }

    @Override
    public void put(String storageKey, Path localPath) {
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(storageKey)
                            .contentType(CONTENT_TYPE)
                            .build(),
                    RequestBody.fromFile(localPath));
            log.debug("Uploaded {} to bucket {}", storageKey, bucket);
        } catch (SdkException e) {
            throw new StorageException("Upload failed: " + e.getMessage(), e, storageKey, "put");
        }
    }

    @Override
    public boolean delete(String storageKey) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(storageKey).build());
            return true;
        } catch (SdkException e) {
            throw new StorageException("Delete failed: " + e.getMessage(), e, storageKey, "delete");
        }
    }

    @Override
    public boolean exists(String storageKey) {
        return head(storageKey).isPresent();
    }

    @Override
    public Optional<Long> size(String storageKey) {
        return head(storageKey).map(HeadObjectResponse::contentLength);
    }

    @Override
    public Optional<String> urlFor(String storageKey, Duration ttl) {
        try {
            GetObjectPresignRequest request = GetObjectPresignRequest.builder()
                    .signatureDuration(ttl)
                    .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(storageKey).build())
                    .build();
            return Optional.of(presigner.presignGetObject(request).url().toString());
        } catch (SdkException e) {
            log.warn("Could not presign URL for {}: {}", storageKey, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<HeadObjectResponse> head(String storageKey) {
        try {
            return Optional.of(s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(storageKey)
                    .build()));
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return Optional.empty();
            }
            log.warn("Remote head failed for {}: {}", storageKey, e.getMessage());
            return Optional.empty();
        } catch (SdkException e) {
            log.warn("Remote head failed for {}: {}", storageKey, e.getMessage());
            return Optional.empty();
        }
    }
}
