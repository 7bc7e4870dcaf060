package io.github.drompincen.payverify.protocol.api;

import java.util.Locale;

public enum FieldName {
    NAME,
    SALARY,
    EMPLOYER,
    SSN;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
