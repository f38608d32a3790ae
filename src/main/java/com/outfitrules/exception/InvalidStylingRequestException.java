package com.outfitrules.exception;

public class InvalidStylingRequestException extends OutfitRulesException {
    public InvalidStylingRequestException(String message) {
        super("INVALID_STYLING_REQUEST", message);
    }
}
