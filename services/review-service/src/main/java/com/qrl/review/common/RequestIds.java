package com.qrl.review.common;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

/** Trace and request ids echoed on every response; missing headers get fresh UUIDs. */
public record RequestIds(String traceId, String requestId) {
    public static final String TRACE_HEADER = "x-trace-id";
    public static final String REQUEST_HEADER = "x-request-id";

    public static RequestIds resolve(String traceHeader, String requestHeader) {
        return new RequestIds(orNew(traceHeader), orNew(requestHeader));
    }

    public static RequestIds from(HttpServletRequest request) {
        return resolve(request.getHeader(TRACE_HEADER), request.getHeader(REQUEST_HEADER));
    }

    private static String orNew(String header) {
        return header == null || header.isBlank() ? UUID.randomUUID().toString() : header.trim();
    }
}
