package com.findstaffing.api.compliance;

import com.findstaffing.api.config.StaffingProperties;
import com.findstaffing.api.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.time.Duration;
import java.util.List;

/**
 * Compliance documents in an S3 (or S3-compatible) bucket.
 */
@Component
public class S3DocumentStorage implements DocumentStorage {

    private static final Logger log = LoggerFactory.getLogger(S3DocumentStorage.class);

    private final S3Client s3Client;
    private final S3Presigner presigner;
    private final String bucket;

    public S3DocumentStorage(S3Client s3Client, S3Presigner presigner, StaffingProperties properties) {
        this.s3Client = s3Client;
        this.presigner = presigner;
        this.bucket = properties.getStorage().getBucket();
    }

    @Override
    public void upload(String path, byte[] content, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(path)
                .contentType(contentType)
                .contentLength((long) content.length)
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
            log.debug("Stored {} ({} bytes) in bucket {}", path, content.length, bucket);
        } catch (SdkException e) {
            throw new StorageException("Failed to upload " + path, e);
        }
    }

    @Override
    public void remove(List<String> paths) {
        if (paths.isEmpty()) {
            return;
        }
        List<ObjectIdentifier> objects = paths.stream()
                .map(path -> ObjectIdentifier.builder().key(path).build())
                .toList();
        DeleteObjectsRequest request = DeleteObjectsRequest.builder()
                .bucket(bucket)
                .delete(Delete.builder().objects(objects).quiet(true).build())
                .build();
        try {
            DeleteObjectsResponse response = s3Client.deleteObjects(request);
            if (response.hasErrors() && !response.errors().isEmpty()) {
                throw new StorageException("Failed to remove " + response.errors().get(0).key()
                        + ": " + response.errors().get(0).message(), null);
            }
        } catch (SdkException e) {
            throw new StorageException("Failed to remove " + paths, e);
        }
    }

    @Override
    public String createSignedUrl(String path, Duration ttl) {
        GetObjectPresignRequest request = GetObjectPresignRequest.builder()
                .signatureDuration(ttl)
                .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(path).build())
                .build();
        try {
            return presigner.presignGetObject(request).url().toString();
        } catch (SdkException e) {
            throw new StorageException("Failed to sign URL for " + path, e);
        }
    }

    @Override
    public String objectPathOf(String documentUrl) {
        return DocumentPaths.extractObjectPath(documentUrl, bucket);
    }
}
