package com.tradingcards.web;

import com.tradingcards.oracle.PriceEvidenceException;
import com.tradingcards.service.GameRuleViolationException;
import com.tradingcards.service.randomness.RandomnessUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GameExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GameExceptionHandler.class);

    @ExceptionHandler(GameRuleViolationException.class)
    public ResponseEntity<GameErrorResponse> handle(GameRuleViolationException ex) {
        return ResponseEntity
                .status(statusOf(ex.getViolation()))
                .body(new GameErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(PriceEvidenceException.class)
    public ResponseEntity<GameErrorResponse> handle(PriceEvidenceException ex) {
        HttpStatus status = ex.getReason() == PriceEvidenceException.Reason.INSUFFICIENT_FEE
                ? HttpStatus.PAYMENT_REQUIRED
                : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity
                .status(status)
                .body(new GameErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(RandomnessUnavailableException.class)
    public ResponseEntity<GameErrorResponse> handle(RandomnessUnavailableException ex) {
        log.warn("Randomness unavailable: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new GameErrorResponse("randomness_unavailable", ex.getMessage()));
    }

    static HttpStatus statusOf(GameRuleViolationException.Violation violation) {
        return switch (violation) {
            case GAME_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case WRONG_PHASE, DEADLINE_PASSED, ALREADY_PARTICIPANT, ALREADY_IN_ACTIVE_GAME, ALREADY_COMMITTED ->
                    HttpStatus.CONFLICT;
            case NOT_A_PARTICIPANT -> HttpStatus.FORBIDDEN;
            case INVALID_SELECTION_SIZE, CARD_NOT_IN_GAME, DUPLICATE_SELECTION, INVALID_PLAYER_ADDRESS ->
                    HttpStatus.BAD_REQUEST;
        };
    }

    public record GameErrorResponse(
            String code,
            String message
    ) {
    }
}
