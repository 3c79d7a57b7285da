package com.findstaffing.api.compliance;

import com.findstaffing.core.domain.ComplianceType;

import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Object path rules for compliance documents.
 */
public final class DocumentPaths {

    private static final Map<String, String> MIME_EXTENSIONS = Map.of(
            "application/pdf", "pdf",
            "image/png", "png",
            "image/jpeg", "jpg");

    private static final String DEFAULT_EXTENSION = "pdf";

    private DocumentPaths() {}

    /**
     * {@code {agencyId}/{complianceType}/{epochMillis}.{extension}}
     */
    public static String objectPath(UUID agencyId, ComplianceType type, Instant at,
                                    String filename, String contentType) {
        return agencyId + "/" + type.wireValue() + "/" + at.toEpochMilli() + "." + extension(filename, contentType);
    }

    /**
     * Lower-cased filename suffix when the name has a dot; otherwise derived
     * from the MIME type; {@code pdf} when neither helps.
     */
    public static String extension(String filename, String contentType) {
        if (filename != null && filename.contains(".")) {
            String suffix = filename.substring(filename.lastIndexOf('.') + 1);
            return suffix.isEmpty() ? DEFAULT_EXTENSION : suffix.toLowerCase(Locale.ROOT);
        }
        if (contentType == null) {
            return DEFAULT_EXTENSION;
        }
        return MIME_EXTENSIONS.getOrDefault(contentType.toLowerCase(Locale.ROOT), DEFAULT_EXTENSION);
    }

    /**
     * Recovers the object path from a stored document URL.
     *
     * Path-style URLs ({@code https://host/{bucket}/{path}?signature}) are split on
     * the bucket segment; virtual-host URLs ({@code https://{bucket}.host/{path}})
     * use the whole URL path. A bare path is returned without its query string.
     * Returns null when nothing usable remains.
     */
    public static String extractObjectPath(String documentUrl, String bucket) {
        if (documentUrl == null || documentUrl.isBlank()) {
            return null;
        }
        String marker = "/" + bucket + "/";
        int index = documentUrl.indexOf(marker);
        String path;
        if (index >= 0) {
            path = stripQuery(documentUrl.substring(index + marker.length()));
        } else if (documentUrl.startsWith("http://") || documentUrl.startsWith("https://")) {
            path = virtualHostPath(documentUrl, bucket);
        } else {
            path = stripQuery(documentUrl);
        }
        return path == null || path.isBlank() ? null : path;
    }

    private static String virtualHostPath(String documentUrl, String bucket) {
        try {
            URI uri = URI.create(documentUrl);
            if (uri.getHost() == null || !uri.getHost().startsWith(bucket + ".")) {
                return null;
            }
            String rawPath = uri.getPath();
            return rawPath == null ? null : rawPath.replaceFirst("^/+", "");
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String stripQuery(String value) {
        int query = value.indexOf('?');
        return query >= 0 ? value.substring(0, query) : value;
    }
}
