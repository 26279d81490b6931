package com.example.SmartNews.service;

import com.example.SmartNews.config.AppProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Optional copy of finished videos to an S3-compatible bucket (Cloudflare R2 by default).
 * Every call is best effort: failures are logged and reported as an empty result.
 */
@Service
public class RemoteStorageService {
    private static final Logger logger = LoggerFactory.getLogger(RemoteStorageService.class);

    private final AppProperties.Remote settings;
    private S3Client s3Client;

    public RemoteStorageService(AppProperties properties) {
        this.settings = properties.getRemote();
    }

    @PostConstruct
    public void init() {
        if (!settings.isEnabled()) {
            logger.info("Remote storage sync disabled");
            return;
        }
        if (isBlank(settings.getAccessKeyId()) || isBlank(settings.getSecretAccessKey())
                || isBlank(settings.getBucket()) || isBlank(settings.getEndpoint())) {
            logger.error("Remote storage is enabled but credentials, bucket or endpoint are missing; sync disabled");
            return;
        }

        AwsBasicCredentials credentials = AwsBasicCredentials.create(settings.getAccessKeyId(), settings.getSecretAccessKey());
        this.s3Client = S3Client.builder()
                .credentialsProvider(StaticCredentialsProvider.create(credentials))
                .endpointOverride(URI.create(settings.getEndpoint()))
                .region(Region.of(settings.getRegion()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
                        .build())
                .build();
        logger.info("Remote storage sync enabled: bucket={}, prefix={}", settings.getBucket(), settings.getPrefix());
    }

    @PreDestroy
    public void shutdown() {
        if (s3Client != null) {
            s3Client.close();
        }
    }

    public boolean isEnabled() {
        return s3Client != null;
    }

    /**
     * Uploads the file under the configured prefix.
     *
     * @return the remote key, empty when disabled or the upload failed
     */
    public Optional<String> upload(Path file) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        String key = settings.getPrefix() + "/" + file.getFileName();
        try {
            if (!Files.isRegularFile(file)) {
                logger.error("Cannot sync missing file: {}", file);
                return Optional.empty();
            }
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(settings.getBucket())
                    .key(key)
                    .build();
            s3Client.putObject(request, RequestBody.fromFile(file));
            logger.info("Synced {} to {}/{}", file.getFileName(), settings.getBucket(), key);
            return Optional.of(key);
        } catch (S3Exception e) {
            logger.error("Remote sync failed for {}: code={}, message={}",
                    file, e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : "unknown", e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Remote sync error for {}: {}", file, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Total bytes stored under the configured prefix.
     */
    public OptionalLong usedBytes() {
        if (!isEnabled()) {
            return OptionalLong.empty();
        }
        try {
            ListObjectsV2Request request = ListObjectsV2Request.builder()
                    .bucket(settings.getBucket())
                    .prefix(settings.getPrefix() + "/")
                    .build();
            long total = s3Client.listObjectsV2Paginator(request).contents().stream()
                    .mapToLong(S3Object::size)
                    .sum();
            return OptionalLong.of(total);
        } catch (RuntimeException e) {
            logger.error("Failed to read remote storage usage: {}", e.getMessage());
            return OptionalLong.empty();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
