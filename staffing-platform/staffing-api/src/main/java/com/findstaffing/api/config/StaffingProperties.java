package com.findstaffing.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code staffing.*} namespace.
 */
@ConfigurationProperties(prefix = "staffing")
public class StaffingProperties {

    private final Jwt jwt = new Jwt();
    private final Storage storage = new Storage();
    private final Mail mail = new Mail();

    public Jwt getJwt() { return jwt; }
    public Storage getStorage() { return storage; }
    public Mail getMail() { return mail; }

    public static class Jwt {
        /** HMAC secret, at least 32 characters. */
        private String secret;

        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }
    }

    public static class Storage {
        private String bucket = "compliance-documents";
        /** S3-compatible endpoint; empty means the AWS default for the region. */
        private String endpoint;
        private String region = "us-east-1";
        private boolean pathStyleAccess = true;
        private String accessKey;
        private String secretKey;
        private Duration signedUrlTtl = Duration.ofDays(7);
        private long maxUploadBytes = 10L * 1024 * 1024;

        public String getBucket() { return bucket; }
        public void setBucket(String bucket) { this.bucket = bucket; }
        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }
        public boolean isPathStyleAccess() { return pathStyleAccess; }
        public void setPathStyleAccess(boolean pathStyleAccess) { this.pathStyleAccess = pathStyleAccess; }
        public String getAccessKey() { return accessKey; }
        public void setAccessKey(String accessKey) { this.accessKey = accessKey; }
        public String getSecretKey() { return secretKey; }
        public void setSecretKey(String secretKey) { this.secretKey = secretKey; }
        public Duration getSignedUrlTtl() { return signedUrlTtl; }
        public void setSignedUrlTtl(Duration signedUrlTtl) { this.signedUrlTtl = signedUrlTtl; }
        public long getMaxUploadBytes() { return maxUploadBytes; }
        public void setMaxUploadBytes(long maxUploadBytes) { this.maxUploadBytes = maxUploadBytes; }
    }

    public static class Mail {
        /** When false, rejection emails are never attempted. */
        private boolean enabled = true;
        private String from = "FindConstructionStaffing <noreply@findconstructionstaffing.com>";
        private String siteUrl = "https://findconstructionstaffing.com";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getFrom() { return from; }
        public void setFrom(String from) { this.from = from; }
        public String getSiteUrl() { return siteUrl; }
        public void setSiteUrl(String siteUrl) { this.siteUrl = siteUrl; }
    }
}
