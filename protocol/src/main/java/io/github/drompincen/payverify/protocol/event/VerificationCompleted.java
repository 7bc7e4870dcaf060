package io.github.drompincen.payverify.protocol.event;

import io.github.drompincen.payverify.protocol.api.VerificationVerdict;

/** Payload of the final {@code complete} progress event. */
public record VerificationCompleted(String verificationId, VerificationVerdict verdict) {}
