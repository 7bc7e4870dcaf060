package io.github.drompincen.payverify.runtime.verification;

/** An application or document id does not resolve to a stored record. */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
