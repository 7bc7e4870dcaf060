package io.github.drompincen.payverify.protocol.event;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One record of the verification progress stream. {@code seq} starts at 1 and
 * increases by one per event within a run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(
        long seq,
        String step,
        String message,
        int progressPercent,
        boolean error,
        Object payload
) {
    public static ProgressEvent of(long seq, ProgressStep step, Object payload) {
        return new ProgressEvent(seq, step.stepName(), step.defaultMessage(),
                step.progressPercent(), step == ProgressStep.ERROR, payload);
    }

    public static ProgressEvent of(long seq, ProgressStep step) {
        return of(seq, step, null);
    }

    public static ProgressEvent error(long seq, String message) {
        return new ProgressEvent(seq, ProgressStep.ERROR.stepName(), message,
                ProgressStep.ERROR.progressPercent(), true, null);
    }
}
