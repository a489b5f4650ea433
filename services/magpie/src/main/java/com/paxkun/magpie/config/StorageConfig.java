package com.paxkun.magpie.config;

import com.paxkun.magpie.service.LoggerService;
import com.paxkun.magpie.service.storage.LocalFileBlobSink;
import com.paxkun.magpie.service.storage.ObjectStoreBlobSink;
import com.paxkun.magpie.service.storage.StorageRetentionJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;
import java.nio.file.Path;

/**
 * Chooses the blob sink from {@code magpie.storage.type}.
 *
 * Author: Pax
 */
@Slf4j
@Configuration
public class StorageConfig {

    private static final String TYPE = "type";
    private static final String PREFIX = "magpie.storage";

    @Bean
    @ConditionalOnProperty(prefix = PREFIX, name = TYPE, havingValue = "local", matchIfMissing = true)
    public LocalFileBlobSink localFileBlobSink(MagpieProperties properties, LoggerService loggerService) {
        MagpieProperties.Local local = properties.getStorage().getLocal();
        Path root = resolveUploadDir(local.getUploadDir(), loggerService.getDataRoot());
        log.info("📁 Local image storage at {} served from {}", root.toAbsolutePath(), local.getBaseUrl());
        return new LocalFileBlobSink(root, local.getBaseUrl());
    }

    @Bean
    @ConditionalOnProperty(prefix = PREFIX, name = TYPE, havingValue = "local", matchIfMissing = true)
    public StorageRetentionJob storageRetentionJob(LocalFileBlobSink blobSink,
                                                   MagpieProperties properties,
                                                   LoggerService loggerService) {
        return new StorageRetentionJob(blobSink, properties, loggerService);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = PREFIX, name = TYPE, havingValue = "s3")
    public S3Client s3Client(MagpieProperties properties) {
        MagpieProperties.S3 s3 = properties.getStorage().getS3();
        S3ClientBuilder builder = S3Client.builder().region(Region.of(s3.getRegion()));

        if (!s3.getAccessKeyId().isBlank() && !s3.getSecretAccessKey().isBlank()) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(s3.getAccessKeyId(), s3.getSecretAccessKey())));
        } else {
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }

        // Path-style access for MinIO and other S3-compatible endpoints.
        if (!s3.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(s3.getEndpoint())).forcePathStyle(true);
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(prefix = PREFIX, name = TYPE, havingValue = "s3")
    public ObjectStoreBlobSink objectStoreBlobSink(S3Client s3Client, MagpieProperties properties) {
        MagpieProperties.S3 s3 = properties.getStorage().getS3();
        if (s3.getBucket().isBlank()) {
            throw new IllegalStateException("magpie.storage.s3.bucket must be set when magpie.storage.type=s3");
        }
        String publicBaseUrl = publicBaseUrl(s3);
        log.info("☁️ S3 image storage in bucket {} served from {}", s3.getBucket(), publicBaseUrl);
        return new ObjectStoreBlobSink(s3Client, s3.getBucket(), s3.getKeyPrefix(), publicBaseUrl);
    }

    static Path resolveUploadDir(String uploadDir, Path dataRoot) {
        if (uploadDir != null && !uploadDir.isBlank()) {
            return Path.of(uploadDir);
        }
        if (dataRoot != null) {
            return dataRoot.resolve("images");
        }
        return Path.of("uploads");
    }

    static String publicBaseUrl(MagpieProperties.S3 s3) {
        if (!s3.getPublicBaseUrl().isBlank()) {
            return s3.getPublicBaseUrl();
        }
        if (!s3.getEndpoint().isBlank()) {
            String endpoint = s3.getEndpoint().endsWith("/") ? s3.getEndpoint() : s3.getEndpoint() + "/";
            return endpoint + s3.getBucket();
        }
        return "https://" + s3.getBucket() + ".s3." + s3.getRegion() + ".amazonaws.com";
    }
}
