package com.qrl.review.common;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(
    Detail error,
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("request_id") String requestId
) {
    public static ErrorResponse of(String code, String message, RequestIds ids) {
        return new ErrorResponse(new Detail(code, message), ids.traceId(), ids.requestId());
    }

    public record Detail(String code, String message) {
    }
}
