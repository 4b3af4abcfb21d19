package com.sitepulse.core.http;

/**
 * 요청 1회의 결과 태그. 예외 대신 이 값으로 HEAD→GET / http→https 폴백을 결정한다.
 * status 는 RESPONSE 일 때만 의미가 있다.
 */
public record LinkCheckOutcome(Kind kind, int status, String detail) {

    public enum Kind { RESPONSE, TOO_MANY_REDIRECTS, CONNECTION_ERROR }

    public static LinkCheckOutcome response(int status) {
        return new LinkCheckOutcome(Kind.RESPONSE, status, null);
    }

    public static LinkCheckOutcome tooManyRedirects(String detail) {
        return new LinkCheckOutcome(Kind.TOO_MANY_REDIRECTS, 0, detail);
    }

    public static LinkCheckOutcome connectionError(String detail) {
        return new LinkCheckOutcome(Kind.CONNECTION_ERROR, 0, detail);
    }

    public boolean isResponse() { return kind == Kind.RESPONSE; }
}
