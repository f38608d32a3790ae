package com.outfitrules.exception;

public class InvalidRankingRequestException extends OutfitRulesException {
    public InvalidRankingRequestException(String message) {
        super("INVALID_RANKING_REQUEST", message);
    }
}
