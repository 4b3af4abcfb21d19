package com.sitepulse.core.api;

/** SPA 안정화(network idle) 대기 초과. 호출자는 로그만 남기고 진행한다. */
public class RenderWaitTimeoutException extends Exception {
    public RenderWaitTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
