package com.vanphong.backend.global.error;

import java.util.Locale;
import java.util.regex.Pattern;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Error surfaced to API clients as a problem body. {@code code} is the stable machine-readable
 * identifier ({@code permission_denied}, {@code checkout_not_found}, ...); the problem
 * {@code type} is derived from it as {@code urn:problem:vanphong:<code>}.
 */
public class ProblemException extends ResponseStatusException {

    static final String TYPE_PREFIX = "urn:problem:vanphong:";

    private static final Pattern TYPE_UNSAFE = Pattern.compile("[^a-z0-9\\-_.:]+");

    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    static String problemType(String code) {
        return TYPE_PREFIX + TYPE_UNSAFE.matcher(code.toLowerCase(Locale.ROOT)).replaceAll("-");
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return problemType(code);
    }
}
