package com.tradingcards.service;

import lombok.Getter;

/**
 * Caller-visible precondition failure. Raised before any state is touched.
 */
@Getter
public class GameRuleViolationException extends RuntimeException {

    private final Violation violation;

    public GameRuleViolationException(Violation violation, String message) {
        super(message);
        this.violation = violation;
    }

    public String getCode() {
        return violation.code();
    }

    public static GameRuleViolationException gameNotFound(long gameId) {
        return new GameRuleViolationException(Violation.GAME_NOT_FOUND, "Game not found: " + gameId);
    }

    public static GameRuleViolationException wrongPhase(String detail) {
        return new GameRuleViolationException(Violation.WRONG_PHASE, detail);
    }

    public static GameRuleViolationException deadlinePassed(String detail) {
        return new GameRuleViolationException(Violation.DEADLINE_PASSED, detail);
    }

    public static GameRuleViolationException alreadyParticipant(String detail) {
        return new GameRuleViolationException(Violation.ALREADY_PARTICIPANT, detail);
    }

    public static GameRuleViolationException alreadyInActiveGame(String detail) {
        return new GameRuleViolationException(Violation.ALREADY_IN_ACTIVE_GAME, detail);
    }

    public static GameRuleViolationException notParticipant(String detail) {
        return new GameRuleViolationException(Violation.NOT_A_PARTICIPANT, detail);
    }

    public static GameRuleViolationException alreadyCommitted(String detail) {
        return new GameRuleViolationException(Violation.ALREADY_COMMITTED, detail);
    }

    public static GameRuleViolationException invalidSelectionSize(String detail) {
        return new GameRuleViolationException(Violation.INVALID_SELECTION_SIZE, detail);
    }

    public static GameRuleViolationException cardNotInGame(String detail) {
        return new GameRuleViolationException(Violation.CARD_NOT_IN_GAME, detail);
    }

    public static GameRuleViolationException duplicateSelection(String detail) {
        return new GameRuleViolationException(Violation.DUPLICATE_SELECTION, detail);
    }

    public static GameRuleViolationException invalidPlayerAddress(String detail) {
        return new GameRuleViolationException(Violation.INVALID_PLAYER_ADDRESS, detail);
    }

    public enum Violation {
        GAME_NOT_FOUND("game_not_found"),
        WRONG_PHASE("wrong_phase"),
        DEADLINE_PASSED("deadline_passed"),
        ALREADY_PARTICIPANT("already_participant"),
        ALREADY_IN_ACTIVE_GAME("already_in_active_game"),
        NOT_A_PARTICIPANT("not_a_participant"),
        ALREADY_COMMITTED("already_committed"),
        INVALID_SELECTION_SIZE("invalid_selection_size"),
        CARD_NOT_IN_GAME("card_not_in_game"),
        DUPLICATE_SELECTION("duplicate_selection"),
        INVALID_PLAYER_ADDRESS("invalid_player_address");

        private final String code;

        Violation(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }
}
