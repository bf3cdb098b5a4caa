package org.nexus.nexusmonitor.api.error;

public enum ErrorCode {
    BAD_REQUEST, NOT_FOUND, NO_DATA, AUTH_REQUIRED, FORBIDDEN, INTERNAL_ERROR
}
