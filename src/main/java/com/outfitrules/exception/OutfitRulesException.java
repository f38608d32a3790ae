package com.outfitrules.exception;

import lombok.Getter;

@Getter
public abstract class OutfitRulesException extends RuntimeException {
    private final String errorCode;
    protected OutfitRulesException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected OutfitRulesException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
