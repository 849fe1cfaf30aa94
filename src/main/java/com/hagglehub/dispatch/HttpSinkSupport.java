package com.hagglehub.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.hagglehub.store.StoreHttpClient;

import java.io.IOException;
import java.net.http.HttpResponse;

/** Shared POST-and-classify logic for the HTTP sinks. */
abstract class HttpSinkSupport implements DownstreamSink {

    private final StoreHttpClient http;

    protected HttpSinkSupport(StoreHttpClient http) {
        this.http = http;
    }

    protected void post(String path, Object body, String idempotencyKey) {
        HttpResponse<String> resp;
        try {
            resp = http.post(path, body, idempotencyKey);
        } catch (IOException e) {
            throw DownstreamException.io("POST " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DownstreamException.io("POST " + path + " interrupted", e);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new DownstreamException("POST " + path + " returned HTTP " + status + ": " + abbreviate(resp.body()), status);
        }
        var text = resp.body() == null ? "" : resp.body().trim();
        if (text.isEmpty()) return;
        try {
            http.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            throw DownstreamException.malformed("POST " + path + " returned a non-JSON body: " + abbreviate(text), e);
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() > 200 ? s.substring(0, 200) + "..." : s;
    }
}
