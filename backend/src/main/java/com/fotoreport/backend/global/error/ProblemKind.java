package com.fotoreport.backend.global.error;

public enum ProblemKind {
    NOT_FOUND,
    CONFLICT,
    INVALID
}
