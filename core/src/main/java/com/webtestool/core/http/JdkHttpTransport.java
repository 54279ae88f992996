package com.webtestool.core.http;

import com.webtestool.core.model.ScanConfig;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/** java.net.http.HttpClient 기반 기본 전송. 리다이렉트 정책별로 클라이언트를 하나씩 둔다. */
public final class JdkHttpTransport implements HttpTransport {
    private final HttpClient following;
    private final HttpClient direct;
    private final boolean followByDefault;

    public JdkHttpTransport(ScanConfig config) {
        Objects.requireNonNull(config, "config");
        this.followByDefault = config.isFollowRedirects();
        this.following = client(config, HttpClient.Redirect.NORMAL);
        this.direct = client(config, HttpClient.Redirect.NEVER);
    }

    private static HttpClient client(ScanConfig config, HttpClient.Redirect redirect) {
        return HttpClient.newBuilder()
                .followRedirects(redirect)
                .connectTimeout(config.getTimeout())
                .build();
    }

    @Override
    public TransportResponse send(HttpRequest request) throws IOException, InterruptedException {
        return send(request, followByDefault);
    }

    @Override
    public TransportResponse send(HttpRequest request, boolean followRedirects)
            throws IOException, InterruptedException {
        HttpClient client = followRedirects ? following : direct;
        HttpResponse<String> resp = client.send(request, HttpResponse.BodyHandlers.ofString());
        return new TransportResponse(resp.statusCode(), resp.headers().map(), resp.body(), resp.uri());
    }
}
