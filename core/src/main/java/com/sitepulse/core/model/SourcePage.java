package com.sitepulse.core.model;

/** 링크를 처음 발견한 부모 페이지 (제목 + URL) */
public record SourcePage(String title, String url) {}
