package io.github.drompincen.payverify.protocol.api;

import java.time.Instant;
import java.util.Map;

public record VerificationDto(
        String verificationId,
        String applicationId,
        String documentId,
        Map<String, Object> extractedData,
        VerificationVerdict verdict,
        Instant createdAt
) {}
