package io.github.drompincen.payverify.protocol.event;

import java.util.Locale;

/**
 * Steps of an interactive verification run, in emission order. {@link #ERROR}
 * may replace any step and terminates the stream.
 */
public enum ProgressStep {
    STARTING(0, "Starting verification process..."),
    DOWNLOADING(20, "Downloading document from storage..."),
    EXTRACTING(40, "Extracting data using AI OCR..."),
    EXTRACTED(60, "Data extracted successfully"),
    VERIFYING_NAME(70, "Verifying name match..."),
    VERIFYING_SALARY(80, "Verifying salary match..."),
    VERIFYING_EMPLOYER(90, "Verifying employer match..."),
    FINALIZING(95, "Finalizing verification results..."),
    COMPLETE(100, "Verification completed"),
    ERROR(0, "Verification failed");

    private final int progressPercent;
    private final String defaultMessage;

    ProgressStep(int progressPercent, String defaultMessage) {
        this.progressPercent = progressPercent;
        this.defaultMessage = defaultMessage;
    }

    public int progressPercent() { return progressPercent; }

    public String defaultMessage() { return defaultMessage; }

    public String stepName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
