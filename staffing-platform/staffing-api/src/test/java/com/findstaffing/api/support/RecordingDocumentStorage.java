package com.findstaffing.api.support;

import com.findstaffing.api.compliance.DocumentPaths;
import com.findstaffing.api.compliance.DocumentStorage;
import com.findstaffing.api.error.StorageException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Object store double that records every call and produces path-style signed URLs.
 */
public class RecordingDocumentStorage implements DocumentStorage {

    public static final String BUCKET = "compliance-documents";

    public final Map<String, byte[]> objects = new LinkedHashMap<>();
    public final List<String> removed = new ArrayList<>();
    public final List<Duration> signedTtls = new ArrayList<>();
    public boolean failUpload;
    public boolean failSign;
    public boolean failRemove;

    @Override
    public void upload(String path, byte[] content, String contentType) {
        if (failUpload) {
            throw new StorageException("upload failed", null);
        }
        objects.put(path, content);
    }

    @Override
    public void remove(List<String> paths) {
        removed.addAll(paths);
        if (failRemove) {
            throw new StorageException("remove failed", null);
        }
        paths.forEach(objects::remove);
    }

    @Override
    public String createSignedUrl(String path, Duration ttl) {
        if (failSign) {
            throw new StorageException("sign failed", null);
        }
        signedTtls.add(ttl);
        return "https://storage.example.com/object/sign/" + BUCKET + "/" + path + "?token=" + path.hashCode();
    }

    @Override
    public String objectPathOf(String documentUrl) {
        return DocumentPaths.extractObjectPath(documentUrl, BUCKET);
    }
}
