// IPageFetcher.java
package com.mailspider.core.api;

import com.mailspider.core.model.FetchResult;
import java.net.URI;

/**
 * 페이지 fetch 최소 계약: URL을 받아 status/body/error 를 돌려준다.
 * 네트워크/HTTP 상황으로는 예외를 던지지 않고 결과값에 담는다.
 */
public interface IPageFetcher extends AutoCloseable {
    FetchResult fetch(URI url);
    @Override default void close() throws Exception {}
}
