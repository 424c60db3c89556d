package com.platform.dbwatch.healthcheck;

public enum ResultStatus {
    SUCCESS,
    WARNING,
    ERROR
}
