package com.peerlink.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * Common shape of every bridge REST reply: {@code {ok, data?, error?}}.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    boolean ok;

    @Nullable
    T data;

    @Nullable
    String error;

    @JsonCreator
    public ApiResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("data") T data,
        @JsonProperty("error") String error
    ) {
        this.ok = ok;
        this.data = data;
        this.error = error;
    }

    public static <T> ApiResponse<T> success(@Nullable T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> failure(String error) {
        return new ApiResponse<>(false, null, error);
    }
}
