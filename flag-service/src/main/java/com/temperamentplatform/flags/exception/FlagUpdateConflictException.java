package com.temperamentplatform.flags.exception;

import com.temperamentplatform.common.exception.FlagEvaluationException;

/**
 * The stored flag set changed between read and compare-and-append.
 * Callers re-read the subject and evaluate again.
 */
public class FlagUpdateConflictException extends FlagEvaluationException {

    public FlagUpdateConflictException(long subjectId) {
        super(subjectId, "Flag set changed concurrently");
    }
}
