package io.github.drompincen.payverify.protocol.api;

import java.time.Instant;

public record VerificationStatusResponse(
        String status,
        String message,
        Instant lastUpdated
) {
    public static final String NO_DOCUMENTS = "no_documents";

    public static VerificationStatusResponse noDocuments() {
        return new VerificationStatusResponse(NO_DOCUMENTS, "No documents uploaded for verification", null);
    }
}
