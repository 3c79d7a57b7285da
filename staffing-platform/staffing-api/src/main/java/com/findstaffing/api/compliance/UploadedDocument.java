package com.findstaffing.api.compliance;

/**
 * A document received from an admin upload, fully buffered.
 */
public record UploadedDocument(String filename, String contentType, byte[] content) {

    public long size() {
        return content.length;
    }
}
