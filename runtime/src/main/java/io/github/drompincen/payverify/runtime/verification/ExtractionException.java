package io.github.drompincen.payverify.runtime.verification;

/**
 * The OCR collaborator could not produce usable content: it was unreachable,
 * timed out, returned nothing, or returned something that is not a field mapping.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
