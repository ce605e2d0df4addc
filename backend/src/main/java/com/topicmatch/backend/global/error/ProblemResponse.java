package com.topicmatch.backend.global.error;

import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.springframework.http.HttpStatus;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        Map<String, Object> properties
) {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:topicmatch:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String normalized = safeCode.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\-_.]+", "-");
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                DEFAULT_TYPE_PREFIX + normalized,
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                safeDetail,
                instance,
                safeCode,
                Map.of()
        );
    }

    public static ProblemResponse from(ProblemException ex, HttpStatus httpStatus, String instance) {
        return new ProblemResponse(
                ex.getProblemType(),
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                ex.getDetailMessage(),
                instance,
                ex.getCode(),
                ex.getProperties()
        );
    }
}
