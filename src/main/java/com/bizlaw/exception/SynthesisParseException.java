package com.bizlaw.exception;

import lombok.Getter;

/**
 * Model output could not be coerced to the analysis schema.
 * Carries both the raw and the cleaned text so prompt/schema drift can be diagnosed.
 */
@Getter
public class SynthesisParseException extends BizLawException {

    private final String rawOutput;
    private final String cleanedOutput;

    public SynthesisParseException(String message, String rawOutput, String cleanedOutput) {
        super(message);
        this.rawOutput = rawOutput;
        this.cleanedOutput = cleanedOutput;
    }

    public SynthesisParseException(String message, String rawOutput, String cleanedOutput, Throwable cause) {
        super(message, cause);
        this.rawOutput = rawOutput;
        this.cleanedOutput = cleanedOutput;
    }
}
