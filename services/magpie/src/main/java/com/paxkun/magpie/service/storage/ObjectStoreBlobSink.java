package com.paxkun.magpie.service.storage;

import com.paxkun.magpie.exception.StoreException;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.time.Instant;
import java.util.Map;

/**
 * Stores images in an S3-compatible bucket.
 */
@Slf4j
public class ObjectStoreBlobSink implements BlobSink {

    static final String CACHE_CONTROL = "public, max-age=86400";

    private final S3Client s3Client;
    private final String bucket;
    private final String keyPrefix;
    private final String publicBaseUrl;

    /**
     * @param publicBaseUrl prefix that, joined with the object key, yields a public URL
     */
    public ObjectStoreBlobSink(S3Client s3Client, String bucket, String keyPrefix, String publicBaseUrl) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.publicBaseUrl = publicBaseUrl.endsWith("/") ? publicBaseUrl : publicBaseUrl + "/";
    }

    @Override
    public String put(String key, byte[] bytes, String contentType) {
        String objectKey = keyPrefix + key;
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(objectKey)
                .contentType(contentType)
                .cacheControl(CACHE_CONTROL)
                .metadata(Map.of("uploaded-at", Instant.now().toString()))
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(bytes));
        } catch (SdkException e) {
            throw new StoreException("Failed to upload " + objectKey + " to bucket " + bucket + ": " + e.getMessage(), e);
        }
        log.debug("☁️ Uploaded {} bytes to s3://{}/{}", bytes.length, bucket, objectKey);
        return publicBaseUrl + objectKey;
    }

    @Override
    public boolean delete(String key) {
        String objectKey = keyPrefix + key;
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(objectKey).build());
            return true;
        } catch (SdkException e) {
            log.warn("⚠️ Failed to delete s3://{}/{}: {}", bucket, objectKey, e.getMessage());
            return false;
        }
    }
}
