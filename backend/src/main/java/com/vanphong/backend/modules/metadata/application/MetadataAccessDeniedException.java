package com.vanphong.backend.modules.metadata.application;

import com.vanphong.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class MetadataAccessDeniedException extends ProblemException {

    public static final String CODE = "permission_denied";

    public MetadataAccessDeniedException(String detail) {
        super(HttpStatus.FORBIDDEN, CODE, detail);
    }
}
