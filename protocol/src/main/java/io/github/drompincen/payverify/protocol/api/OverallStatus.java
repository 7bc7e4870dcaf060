package io.github.drompincen.payverify.protocol.api;

import java.util.Locale;

public enum OverallStatus {
    VERIFIED,
    MISMATCH,
    ERROR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
