package com.webtestool.core.http;

import java.io.IOException;
import java.net.http.HttpRequest;

/**
 * 네트워크 송신 훅. 기본은 {@link JdkHttpTransport}, 테스트에서는 람다로 교체한다.
 * 타임아웃은 {@link java.net.http.HttpTimeoutException}(IOException)으로 알린다.
 */
@FunctionalInterface
public interface HttpTransport {
    TransportResponse send(HttpRequest request) throws IOException, InterruptedException;

    /** 요청 단위로 리다이렉트 정책을 바꿀 수 없는 전송은 기본 정책으로 보낸다 */
    default TransportResponse send(HttpRequest request, boolean followRedirects)
            throws IOException, InterruptedException {
        return send(request);
    }
}
