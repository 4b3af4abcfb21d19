package com.sitepulse.core.api;

/** 페이지 이동 실패. status는 마지막으로 관측된 HTTP 상태(연결 단계 실패면 0). */
public class NavigationException extends Exception {
    private final int status;

    public NavigationException(String message, int status) {
        super(message);
        this.status = status;
    }

    public NavigationException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int status() { return status; }
}
