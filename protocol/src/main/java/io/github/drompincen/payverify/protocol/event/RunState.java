package io.github.drompincen.payverify.protocol.event;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one verification run:
 * {@code PENDING -> EXTRACTING -> COMPARING -> VERIFIED | MISMATCH}, with
 * {@code ERROR} reachable only while extracting.
 */
public enum RunState {
    PENDING,
    EXTRACTING,
    COMPARING,
    VERIFIED,
    MISMATCH,
    ERROR;

    public Set<RunState> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(EXTRACTING);
            case EXTRACTING -> EnumSet.of(COMPARING, ERROR);
            case COMPARING -> EnumSet.of(VERIFIED, MISMATCH);
            case VERIFIED, MISMATCH, ERROR -> EnumSet.noneOf(RunState.class);
        };
    }

    public boolean canTransitionTo(RunState next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
