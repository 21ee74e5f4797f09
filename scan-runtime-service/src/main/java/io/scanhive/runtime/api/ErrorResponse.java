package io.scanhive.runtime.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String message, Long scanId, String kind) {

    public static ErrorResponse of(String message) {
        return new ErrorResponse(message, null, null);
    }
}
