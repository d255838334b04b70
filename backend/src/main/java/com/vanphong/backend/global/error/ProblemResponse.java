package com.vanphong.backend.global.error;

import org.springframework.http.HttpStatus;

public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        return of(httpStatus, safeCode, detail, instance, ProblemException.problemType(safeCode));
    }

    public static ProblemResponse of(ProblemException ex, String instance) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return of(status, ex.getCode(), ex.getDetailMessage(), instance, ex.getProblemType());
    }

    private static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance, String type) {
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(type, httpStatus.getReasonPhrase(), httpStatus.value(), safeDetail, instance, code);
    }
}
