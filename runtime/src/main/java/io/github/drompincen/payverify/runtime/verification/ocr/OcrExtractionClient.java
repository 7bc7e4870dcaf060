package io.github.drompincen.payverify.runtime.verification.ocr;

import io.github.drompincen.payverify.protocol.api.DocumentRef;

/**
 * Reads a pay document and returns the model's raw reply, expected to hold a
 * JSON object with snake_case pay stub fields. Implementations block; callers
 * wrap them in a retrying executor.
 */
public interface OcrExtractionClient {

    String extract(DocumentRef document);

    /** Model identifier reported in logs. */
    default String modelName() { return "unknown"; }
}
