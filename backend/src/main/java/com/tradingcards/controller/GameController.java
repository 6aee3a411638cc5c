package com.tradingcards.controller;

import com.tradingcards.config.TradingCardsProperties;
import com.tradingcards.controller.dto.GameRequests;
import com.tradingcards.controller.dto.GameResponses;
import com.tradingcards.model.Game;
import com.tradingcards.service.GameQueryService;
import com.tradingcards.service.PhaseScheduler;
import com.tradingcards.service.TransitionResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/games")
public class GameController {

    public static final String PLAYER_HEADER = "X-Player-Address";

    private final PhaseScheduler phaseScheduler;
    private final GameQueryService gameQueryService;
    private final TradingCardsProperties tradingCardsProperties;

    public GameController(PhaseScheduler phaseScheduler,
                          GameQueryService gameQueryService,
                          TradingCardsProperties tradingCardsProperties) {
        this.phaseScheduler = phaseScheduler;
        this.gameQueryService = gameQueryService;
        this.tradingCardsProperties = tradingCardsProperties;
    }

    @PostMapping
    public ResponseEntity<GameResponses.GameCreated> createGame(@RequestHeader(PLAYER_HEADER) String player) {
        long gameId = phaseScheduler.createGame(player);
        return ResponseEntity.status(HttpStatus.CREATED).body(new GameResponses.GameCreated(gameId));
    }

    @PostMapping("/{gameId}/join")
    public ResponseEntity<GameResponses.GamePlayers> joinGame(
            @PathVariable long gameId,
            @RequestHeader(PLAYER_HEADER) String player
    ) {
        Game game = phaseScheduler.joinGame(gameId, player);
        return ResponseEntity.ok(new GameResponses.GamePlayers(game.id(), game.players()));
    }

    @PostMapping("/{gameId}/start")
    public ResponseEntity<?> startGame(
            @PathVariable long gameId,
            @RequestBody(required = false) GameRequests.StartGameRequest request
    ) {
        boolean secure = request != null && request.secureRandomness();
        return toResponse(phaseScheduler.startGame(gameId, secure));
    }

    @PostMapping("/{gameId}/advance")
    public ResponseEntity<?> advanceToResolution(@PathVariable long gameId) {
        return toResponse(phaseScheduler.advanceToResolution(gameId));
    }

    @PostMapping("/{gameId}/choices")
    public ResponseEntity<GameResponses.PlayerChoices> commitChoices(
            @PathVariable long gameId,
            @RequestHeader(PLAYER_HEADER) String player,
            @Valid @RequestBody GameRequests.CommitChoicesRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(GameResponses.PlayerChoices.from(phaseScheduler.commitChoices(gameId, player, request.cards())));
    }

    @PostMapping("/{gameId}/resolve")
    public ResponseEntity<?> resolveAndEnd(
            @PathVariable long gameId,
            @Valid @RequestBody GameRequests.PriceEvidenceRequest request
    ) {
        return toResponse(phaseScheduler.resolveAndEnd(gameId, request.toEvidence()));
    }

    @PostMapping("/{gameId}/end")
    public ResponseEntity<?> endGame(@PathVariable long gameId) {
        return toResponse(phaseScheduler.endGame(gameId));
    }

    @GetMapping("/{gameId}")
    public ResponseEntity<GameResponses.GameState> getGameState(@PathVariable long gameId) {
        return ResponseEntity.ok(GameResponses.GameState.from(gameQueryService.getGame(gameId)));
    }

    @GetMapping("/{gameId}/players")
    public ResponseEntity<GameResponses.GamePlayers> getGamePlayers(@PathVariable long gameId) {
        return ResponseEntity.ok(new GameResponses.GamePlayers(gameId, gameQueryService.getGamePlayers(gameId)));
    }

    @GetMapping("/{gameId}/cards")
    public ResponseEntity<GameResponses.GameCards> getGameCards(@PathVariable long gameId) {
        return ResponseEntity.ok(new GameResponses.GameCards(
                gameId,
                gameQueryService.getGameCards(gameId),
                gameQueryService.getDecodedGameCards(gameId).stream().map(GameResponses.CardView::from).toList()
        ));
    }

    @GetMapping("/{gameId}/choices/{player}")
    public ResponseEntity<GameResponses.PlayerChoices> getPlayerChoices(
            @PathVariable long gameId,
            @PathVariable String player
    ) {
        return ResponseEntity.ok(GameResponses.PlayerChoices.from(gameQueryService.getPlayerChoices(gameId, player)));
    }

    @GetMapping("/{gameId}/predictions/{cardIdentifier}")
    public ResponseEntity<GameResponses.Prediction> getPredictionResult(
            @PathVariable long gameId,
            @PathVariable int cardIdentifier
    ) {
        return ResponseEntity.ok(GameResponses.Prediction.from(
                gameId, gameQueryService.getPredictionResult(gameId, cardIdentifier)));
    }

    @GetMapping("/next-id")
    public ResponseEntity<GameResponses.NextGameId> getNextGameId() {
        return ResponseEntity.ok(new GameResponses.NextGameId(gameQueryService.getNextGameId()));
    }

    @GetMapping("/config")
    public ResponseEntity<GameResponses.GameConfig> getConfig() {
        TradingCardsProperties.Game rules = tradingCardsProperties.getGame();
        TradingCardsProperties.Points points = tradingCardsProperties.getPoints();
        return ResponseEntity.ok(new GameResponses.GameConfig(
                rules.getLobbyDuration().getSeconds(),
                rules.getChoiceDuration().getSeconds(),
                rules.getResolutionDuration().getSeconds(),
                rules.getSelectionSize(),
                rules.getCardSetSize(),
                rules.isAllowDuplicateSelections(),
                points.getPriceUpDown(),
                points.getPriceAboveBelow(),
                points.getMarketCapVolume(),
                points.getPercentageChange()
        ));
    }

    private static ResponseEntity<?> toResponse(TransitionResult result) {
        if (!result.applied()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(GameResponses.NoActionNeeded.from(result));
        }
        return ResponseEntity.ok(GameResponses.Transition.from(result));
    }
}
