package com.temperamentplatform.flags.exception;

import com.temperamentplatform.common.exception.FlagEvaluationException;

public class SubjectNotFoundException extends FlagEvaluationException {

    public SubjectNotFoundException(long subjectId) {
        super(subjectId, "Subject not found");
    }
}
