package com.bizlaw.exception;

public class LlmException extends BizLawException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
