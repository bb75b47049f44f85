package io.coordhub.error;

public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    UNKNOWN_METHOD
}
