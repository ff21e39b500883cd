package com.github.salilvnair.portassist.response;

public enum ResponseStatus {
    OK("ok"),
    FAILED("failed"),
    VALIDATION_FAILED("validation_failed");

    private final String value;

    ResponseStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
