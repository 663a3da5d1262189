package com.storewatch.monitor.client;

import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.util.Optional;

/**
 * {@link ArtifactStore} on an S3-compatible bucket (AWS S3, Cloudflare R2, MinIO).
 *
 * Objects are immutable once written (keys embed a timestamp), so they are uploaded
 * with a one-year public cache header.  Public URLs are {@code {public-url}/{key}}.
 */
@Singleton
public class S3ArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(S3ArtifactStore.class);

    static final String CONTENT_TYPE = "image/png";
    static final String CACHE_CONTROL = "public, max-age=31536000";

    private final S3Client s3Client;
    private final String bucket;
    private final String publicUrl;

    @Inject
    public S3ArtifactStore(S3Client s3Client,
                           @Value("${artifacts.bucket}") String bucket,
                           @Value("${artifacts.public-url}") String publicUrl) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.publicUrl = publicUrl.endsWith("/") ? publicUrl.substring(0, publicUrl.length() - 1) : publicUrl;
    }

    @Override
    public String put(String key, byte[] bytes) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(CONTENT_TYPE)
                .cacheControl(CACHE_CONTROL)
                .build();

        s3Client.putObject(request, RequestBody.fromBytes(bytes));
        log.info("Uploaded artifact key={} bytes={}", key, bytes.length);
        return publicUrl + "/" + key;
    }

    /**
     * Strips the configured public base when the URL carries it (the base may itself
     * have a path, e.g. a path-style bucket URL); other URLs fall back to their path.
     */
    @Override
    public Optional<String> keyFromPublicUrl(String url) {
        if (url != null && url.startsWith(publicUrl + "/")) {
            String key = url.substring(publicUrl.length() + 1);
            return key.isEmpty() ? Optional.empty() : Optional.of(key);
        }
        return ArtifactStore.super.keyFromPublicUrl(url);
    }

    @Override
    public Optional<byte[]> get(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }

        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();

        try {
            ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(request);
            return Optional.of(response.asByteArray());
        } catch (NoSuchKeyException e) {
            log.warn("Artifact not found key={}", key);
            return Optional.empty();
        } catch (SdkException e) {
            log.error("Artifact download failed key={}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
