package com.github.salilvnair.portassist.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class PortAssistException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public PortAssistException(PortAssistErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public PortAssistException(PortAssistErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public PortAssistException(PortAssistErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public PortAssistException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }
}
