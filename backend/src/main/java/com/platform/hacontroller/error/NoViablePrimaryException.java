package com.platform.hacontroller.error;

import java.util.List;

/**
 * Every promotion candidate was fenced, unreachable or failed to promote.
 * Automatic remediation halts until an operator intervenes.
 */
public class NoViablePrimaryException extends ControlPlaneException {

    private final List<String> attemptedCandidates;

    public NoViablePrimaryException(List<String> attemptedCandidates) {
        super(ErrorCode.NO_VIABLE_PRIMARY,
            "No viable primary candidate remains (attempted: " + attemptedCandidates + ")");
        this.attemptedCandidates = List.copyOf(attemptedCandidates);
    }

    public List<String> getAttemptedCandidates() {
        return attemptedCandidates;
    }
}
