package com.finsight.data.http;

import java.io.IOException;

/**
 * Non-2xx answer from an HTTP endpoint.
 */
public class HttpStatusException extends IOException {
    private final int statusCode;
    private final String url;

    public HttpStatusException(int statusCode, String url, String bodySample) {
        super("HTTP " + statusCode + " for " + url + (bodySample == null || bodySample.isEmpty() ? "" : " body=" + bodySample));
        this.statusCode = statusCode;
        this.url = url;
    }

    public int statusCode() {
        return statusCode;
    }

    public String url() {
        return url;
    }
}
