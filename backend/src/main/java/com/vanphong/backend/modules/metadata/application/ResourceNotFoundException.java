package com.vanphong.backend.modules.metadata.application;

import com.vanphong.backend.global.error.ProblemException;
import com.vanphong.backend.modules.metadata.domain.ResourceClass;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends ProblemException {

    public static final String UNKNOWN_RESOURCE_CODE = "resource_not_found";

    public ResourceNotFoundException(ResourceClass resourceClass) {
        super(HttpStatus.NOT_FOUND, resourceClass.notFoundCode());
    }

    private ResourceNotFoundException(String code, String detail) {
        super(HttpStatus.NOT_FOUND, code, detail);
    }

    public static ResourceNotFoundException unknownResource(String segment) {
        return new ResourceNotFoundException(UNKNOWN_RESOURCE_CODE, "Unknown resource: " + segment);
    }
}
