package com.findstaffing.core.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Document/verification state of one (agency, compliance type) row.
 *
 * Only the transitions below exist; a verified state without a document
 * cannot be constructed.
 *
 * <pre>
 *   NoDocument    --upload--> PendingReview
 *   PendingReview --upload--> PendingReview (replacement)
 *   Verified      --upload--> PendingReview (replacement drops verification)
 *   PendingReview --verify--> Verified
 *   Verified      --verify--> Verified      (re-stamped)
 *   PendingReview --reject--> NoDocument
 *   Verified      --reject--> NoDocument
 *   any           --remove--> NoDocument
 * </pre>
 */
public sealed interface ComplianceDocumentState
        permits ComplianceDocumentState.NoDocument,
                ComplianceDocumentState.PendingReview,
                ComplianceDocumentState.Verified {

    String name();

    /** Document reference, or null when there is none. */
    String documentUrl();

    default boolean hasDocument() {
        return documentUrl() != null;
    }

    default boolean isVerified() {
        return this instanceof Verified;
    }

    default ComplianceDocumentState upload(String newDocumentUrl) {
        return new PendingReview(newDocumentUrl);
    }

    default ComplianceDocumentState verify(UUID verifierId, Instant at) {
        throw new IllegalTransitionException("Cannot verify compliance without a supporting document");
    }

    default ComplianceDocumentState reject() {
        throw new IllegalTransitionException("No document to reject");
    }

    default ComplianceDocumentState removeDocument() {
        return NoDocument.INSTANCE;
    }

    /**
     * Rebuilds the state from stored columns. Rows written before the
     * state model (verified flag set without a document) read as NoDocument.
     */
    static ComplianceDocumentState of(String documentUrl, boolean verified, UUID verifiedBy, Instant verifiedAt) {
        if (documentUrl == null) {
            return NoDocument.INSTANCE;
        }
        if (verified && verifiedBy != null && verifiedAt != null) {
            return new Verified(documentUrl, verifiedBy, verifiedAt);
        }
        return new PendingReview(documentUrl);
    }

    record NoDocument() implements ComplianceDocumentState {
        static final NoDocument INSTANCE = new NoDocument();

        @Override public String name() { return "NO_DOCUMENT"; }
        @Override public String documentUrl() { return null; }
    }

    record PendingReview(String documentUrl) implements ComplianceDocumentState {
        public PendingReview {
            Objects.requireNonNull(documentUrl, "documentUrl");
        }

        @Override public String name() { return "PENDING_REVIEW"; }

        @Override
        public ComplianceDocumentState verify(UUID verifierId, Instant at) {
            return new Verified(documentUrl, verifierId, at);
        }

        @Override
        public ComplianceDocumentState reject() {
            return NoDocument.INSTANCE;
        }
    }

    record Verified(String documentUrl, UUID verifiedBy, Instant verifiedAt) implements ComplianceDocumentState {
        public Verified {
            Objects.requireNonNull(documentUrl, "documentUrl");
            Objects.requireNonNull(verifiedBy, "verifiedBy");
            Objects.requireNonNull(verifiedAt, "verifiedAt");
        }

        @Override public String name() { return "VERIFIED"; }

        @Override
        public ComplianceDocumentState verify(UUID verifierId, Instant at) {
            return new Verified(documentUrl, verifierId, at);
        }

        @Override
        public ComplianceDocumentState reject() {
            return NoDocument.INSTANCE;
        }
    }

    /**
     * Thrown for a (state, action) pair the lifecycle does not allow.
     */
    class IllegalTransitionException extends RuntimeException {
        public IllegalTransitionException(String message) {
            super(message);
        }
    }
}
