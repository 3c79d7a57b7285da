package com.findstaffing.api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

/**
 * S3 client and presigner for compliance documents.
 * Path-style addressing keeps the bucket name in every object URL.
 */
@Configuration
public class StorageConfig {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(StaffingProperties properties) {
        StaffingProperties.Storage storage = properties.getStorage();
        var builder = S3Client.builder()
                .region(Region.of(storage.getRegion()))
                .credentialsProvider(credentials(storage))
                .serviceConfiguration(s3Configuration(storage));
        if (hasText(storage.getEndpoint())) {
            builder.endpointOverride(URI.create(storage.getEndpoint()));
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    public S3Presigner s3Presigner(StaffingProperties properties) {
        StaffingProperties.Storage storage = properties.getStorage();
        var builder = S3Presigner.builder()
                .region(Region.of(storage.getRegion()))
                .credentialsProvider(credentials(storage))
                .serviceConfiguration(s3Configuration(storage));
        if (hasText(storage.getEndpoint())) {
            builder.endpointOverride(URI.create(storage.getEndpoint()));
        }
        return builder.build();
    }

    private S3Configuration s3Configuration(StaffingProperties.Storage storage) {
        return S3Configuration.builder()
                .pathStyleAccessEnabled(storage.isPathStyleAccess())
                .build();
    }

    private AwsCredentialsProvider credentials(StaffingProperties.Storage storage) {
        if (hasText(storage.getAccessKey()) && hasText(storage.getSecretKey())) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(storage.getAccessKey(), storage.getSecretKey()));
        }
        return DefaultCredentialsProvider.create();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
