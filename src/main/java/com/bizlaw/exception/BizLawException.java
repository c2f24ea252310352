package com.bizlaw.exception;

public class BizLawException extends RuntimeException {

    public BizLawException(String message) {
        super(message);
    }

    public BizLawException(String message, Throwable cause) {
        super(message, cause);
    }
}
