package com.bizlaw.exception;

public class ArtifactFormatException extends BizLawException {

    public ArtifactFormatException(String message) {
        super(message);
    }

    public ArtifactFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
