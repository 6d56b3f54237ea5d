package com.scoutharvest.core.service;

/** 실행 전체를 중단시키는 치명적 실패(예: 프록시 풀이 poolMaxWait 넘게 전부 격리). */
public class ScrapeAbortedException extends RuntimeException {
    public ScrapeAbortedException(String message) { super(message); }
    public ScrapeAbortedException(String message, Throwable cause) { super(message, cause); }
}
