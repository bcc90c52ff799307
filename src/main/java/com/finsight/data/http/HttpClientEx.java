package com.finsight.data.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * 模块说明：HttpClientEx（class）。
 * 主要职责：封装 JDK HttpClient 的 GET 请求，统一超时、User-Agent 与非 2xx 状态处理。
 * 使用建议：测试中可继承并覆盖 getText，返回固定报文或抛出指定异常。
 */
public class HttpClientEx {
    private static final int BODY_SAMPLE_CHARS = 160;
    private final HttpClient client;

    public HttpClientEx(int connectTimeoutSeconds) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(Math.max(1, connectTimeoutSeconds)))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

/**
 * 方法说明：getText，负责发起 GET 请求并返回响应正文。
 * 处理流程：2xx 直接返回；其他状态码抛出 HttpStatusException，由调用方按状态码分类。
 */
    public String getText(String url, int timeoutSeconds) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .GET()
                .header("User-Agent", "Mozilla/5.0 (FinSight/1.0)")
                .header("Accept", "application/json,text/csv,*/*")
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
            return resp.body();
        }
        String body = resp.body() == null ? "" : resp.body().trim();
        String sample = body.length() > BODY_SAMPLE_CHARS ? body.substring(0, BODY_SAMPLE_CHARS) : body;
        throw new HttpStatusException(resp.statusCode(), url, sample);
    }
}
