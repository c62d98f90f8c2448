package com.adsgateway.core;

import com.adsgateway.normalize.NormalizedEntity;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Structured outcome handed back to the caller. Either data or an error kind, never both.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResult {

    boolean success;

    List<NormalizedEntity> data;

    ErrorKind errorKind;

    String message;

    Set<String> missingScopes;

    public static ApiResult success(List<NormalizedEntity> data) {
        return ApiResult.builder()
                .success(true)
                .data(List.copyOf(data))
                .build();
    }

    public static ApiResult failure(GatewayException e) {
        return ApiResult.builder()
                .success(false)
                .errorKind(e.getKind())
                .message(e.getMessage())
                .missingScopes(e.getMissingScopes().isEmpty() ? null : e.getMissingScopes())
                .build();
    }
}
