package com.scoutharvest.core.http;

import com.scoutharvest.core.model.ErrorKind;
import com.scoutharvest.core.model.FetchResult;

/** 작업 단위 fetch 실패. 스킵 기록 후 실행은 계속된다. */
public class FetchFailedException extends Exception {
    private final ErrorKind kind;
    private final transient FetchResult lastResult;

    public FetchFailedException(ErrorKind kind, String message, FetchResult lastResult) {
        super(message);
        this.kind = kind;
        this.lastResult = lastResult;
    }

    public ErrorKind getKind() { return kind; }

    /** 마지막 시도 결과. 한 번도 전송하지 못했으면 null. */
    public FetchResult getLastResult() { return lastResult; }
}
