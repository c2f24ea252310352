package com.bizlaw.exception;

public class SessionNotFoundException extends BizLawException {

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
    }
}
