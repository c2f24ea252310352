package com.bizlaw.exception;

import lombok.Getter;

@Getter
public class SynthesisTimeoutException extends BizLawException {

    private final long timeoutSeconds;

    public SynthesisTimeoutException(long timeoutSeconds) {
        super("Synthesis did not complete within " + timeoutSeconds + "s");
        this.timeoutSeconds = timeoutSeconds;
    }
}
