package io.github.drompincen.payverify.runtime.verification;

/** The verdict store failed to write or read a verification. */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
