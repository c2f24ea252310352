package com.bizlaw.exception;

public class ConfigurationException extends BizLawException {

    public ConfigurationException(String message) {
        super(message);
    }
}
