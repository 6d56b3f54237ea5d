package com.scoutharvest.core.api;

import com.scoutharvest.core.model.FetchResult;
import com.scoutharvest.core.proxy.ProxyHandle;

import java.net.URI;

/**
 * GET 1회 전송. 분류(outcome)는 하지 않는다: 상태코드/헤더/본문 또는 실패 상세만 채운다.
 * 네트워크 예외는 statusCode -1 결과로 돌려준다.
 */
public interface IPageFetcher {
    FetchResult fetchOnce(URI url, ProxyHandle proxy) throws InterruptedException;
}
