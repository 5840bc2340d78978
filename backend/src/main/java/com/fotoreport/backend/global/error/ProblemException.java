package com.fotoreport.backend.global.error;

public class ProblemException extends RuntimeException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:fotoreport:";

    private final ProblemKind kind;
    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(ProblemKind kind, String code) {
        this(kind, code, null);
    }

    public ProblemException(ProblemKind kind, String code, String detail) {
        super(code);
        if (kind == null) {
            throw new IllegalArgumentException("ProblemException kind must not be null");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.kind = kind;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    public static ProblemException notFound(String code, String detail) {
        return new ProblemException(ProblemKind.NOT_FOUND, code, detail);
    }

    public static ProblemException conflict(String code, String detail) {
        return new ProblemException(ProblemKind.CONFLICT, code, detail);
    }

    public static ProblemException invalid(String code, String detail) {
        return new ProblemException(ProblemKind.INVALID, code, detail);
    }

    public ProblemKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }
}
