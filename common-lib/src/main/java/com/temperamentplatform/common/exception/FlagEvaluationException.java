package com.temperamentplatform.common.exception;

/**
 * Root of the unchecked exceptions raised while evaluating a subject's flags.
 * Messages carry the subject id as a {@code [subject-<id>]} prefix.
 */
public class FlagEvaluationException extends RuntimeException {
    private final long subjectId;

    public FlagEvaluationException(long subjectId, String message) {
        super("[subject-" + subjectId + "] " + message);
        this.subjectId = subjectId;
    }

    public FlagEvaluationException(long subjectId, String message, Throwable cause) {
        super("[subject-" + subjectId + "] " + message, cause);
        this.subjectId = subjectId;
    }

    public long getSubjectId() {
        return subjectId;
    }
}
