package com.tradingcards.controller;

import com.tradingcards.config.TradingCardsProperties;
import com.tradingcards.model.Card;
import com.tradingcards.model.Game;
import com.tradingcards.model.GamePhase;
import com.tradingcards.model.PlayerChoice;
import com.tradingcards.model.PredictionResult;
import com.tradingcards.model.PriceMetric;
import com.tradingcards.oracle.PriceEvidence;
import com.tradingcards.oracle.PriceEvidenceException;
import com.tradingcards.service.CardCatalog;
import com.tradingcards.service.CardCodec;
import com.tradingcards.service.GameQueryService;
import com.tradingcards.service.GameRuleViolationException;
import com.tradingcards.service.PhaseScheduler;
import com.tradingcards.service.TransitionResult;
import com.tradingcards.service.randomness.RandomnessUnavailableException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GameController.class)
@Import(TradingCardsProperties.class)
class GameControllerTest {

    private static final String PLAYER = "0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PhaseScheduler phaseScheduler;

    @MockitoBean
    private GameQueryService gameQueryService;

    @Test
    void createGameReturnsCreatedId() throws Exception {
        when(phaseScheduler.createGame(PLAYER)).thenReturn(7L);

        mockMvc.perform(post("/api/games").header(GameController.PLAYER_HEADER, PLAYER))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.gameId").value(7));
    }

    @Test
    void createGameWithoutPlayerHeaderIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/games"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("missing_header"));

        verify(phaseScheduler, never()).createGame(anyString());
    }

    @Test
    void joinConflictMapsToConflictWithCode() throws Exception {
        when(phaseScheduler.joinGame(1L, PLAYER))
                .thenThrow(GameRuleViolationException.alreadyInActiveGame("Player is already in active game 2"));

        mockMvc.perform(post("/api/games/1/join").header(GameController.PLAYER_HEADER, PLAYER))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("already_in_active_game"))
                .andExpect(jsonPath("$.message").value("Player is already in active game 2"));
    }

    @Test
    void joinReturnsPlayersInJoinOrder() throws Exception {
        Game game = Game.open(1, "0xAAA", NOW, NOW.plusSeconds(60)).withPlayer(PLAYER);
        when(phaseScheduler.joinGame(1L, PLAYER)).thenReturn(game);

        mockMvc.perform(post("/api/games/1/join").header(GameController.PLAYER_HEADER, PLAYER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.players[0]").value("0xAAA"))
                .andExpect(jsonPath("$.players[1]").value(PLAYER));
    }

    @Test
    void startWithoutBodyUsesInsecureRandomness() throws Exception {
        when(phaseScheduler.startGame(1L, false)).thenReturn(new TransitionResult(1, true, GamePhase.CHOICE, "Cards generated"));

        mockMvc.perform(post("/api/games/1/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.applied").value(true))
                .andExpect(jsonPath("$.phase").value("CHOICE"));
    }

    @Test
    void startNotAppliedReportsNoActionNeeded() throws Exception {
        when(phaseScheduler.startGame(1L, true))
                .thenReturn(new TransitionResult(1, false, GamePhase.LOBBY, "Lobby deadline not reached"));

        mockMvc.perform(post("/api/games/1/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"secureRandomness\": true}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("no_action_needed"))
                .andExpect(jsonPath("$.phase").value("LOBBY"));
    }

    @Test
    void startWithUnavailableRandomnessIsServiceUnavailable() throws Exception {
        when(phaseScheduler.startGame(1L, true)).thenThrow(new RandomnessUnavailableException("beacon not configured"));

        mockMvc.perform(post("/api/games/1/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"secureRandomness\": true}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("randomness_unavailable"));
    }

    @Test
    void commitChoicesReturnsRecordedSelection() throws Exception {
        when(phaseScheduler.commitChoices(1L, PLAYER, List.of(0, 10, 21)))
                .thenReturn(new PlayerChoice(1, PLAYER, List.of(0, 10, 21), NOW, true));

        mockMvc.perform(post("/api/games/1/choices")
                        .header(GameController.PLAYER_HEADER, PLAYER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cards\": [0, 10, 21]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.committed").value(true))
                .andExpect(jsonPath("$.selectedCards[2]").value(21));
    }

    @Test
    void commitChoicesValidationFailureNeverReachesScheduler() throws Exception {
        mockMvc.perform(post("/api/games/1/choices")
                        .header(GameController.PLAYER_HEADER, PLAYER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cards\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"));

        verify(phaseScheduler, never()).commitChoices(anyLong(), anyString(), anyList());
    }

    @Test
    void commitChoicesByOutsiderIsForbidden() throws Exception {
        when(phaseScheduler.commitChoices(eq(1L), eq(PLAYER), anyList()))
                .thenThrow(GameRuleViolationException.notParticipant("Player is not a participant of game 1"));

        mockMvc.perform(post("/api/games/1/choices")
                        .header(GameController.PLAYER_HEADER, PLAYER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cards\": [0, 10, 21]}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("not_a_participant"));
    }

    @Test
    void resolveConvertsEvidenceBody() throws Exception {
        when(phaseScheduler.resolveAndEnd(eq(1L), any()))
                .thenReturn(new TransitionResult(1, true, GamePhase.ENDED, "Resolved with price evidence"));

        mockMvc.perform(post("/api/games/1/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "updates": [
                                    {
                                      "id": "0xe62df6c8b4a85fe1a67db44dc12de5db330f7ac66b72dc658afedf0f4a415b43",
                                      "metric": "market_cap",
                                      "price": {"price": "6500000000000", "conf": "1000", "expo": -8, "publish_time": 1772366520}
                                    }
                                  ],
                                  "fee": 1
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("ENDED"));

        ArgumentCaptor<PriceEvidence> captor = ArgumentCaptor.forClass(PriceEvidence.class);
        verify(phaseScheduler).resolveAndEnd(eq(1L), captor.capture());
        PriceEvidence evidence = captor.getValue();
        assertEquals(BigInteger.ONE, evidence.fee());
        assertEquals(PriceMetric.MARKET_CAP, evidence.updates().get(0).metric());
        assertEquals(-8, evidence.updates().get(0).price().expo());
        assertEquals(1772366520L, evidence.updates().get(0).price().publishTime());
    }

    @Test
    void resolveMapsEvidenceRejections() throws Exception {
        String body = "{\"updates\": [], \"fee\": 0}";
        when(phaseScheduler.resolveAndEnd(eq(1L), any()))
                .thenThrow(PriceEvidenceException.insufficientFee("Update fee is 2 wei"))
                .thenThrow(PriceEvidenceException.stalePrice("Latest update too old"));

        mockMvc.perform(post("/api/games/1/resolve").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.code").value("insufficient_fee"));
        mockMvc.perform(post("/api/games/1/resolve").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("stale_price"));
    }

    @Test
    void unknownGameIsNotFound() throws Exception {
        when(gameQueryService.getGame(404L)).thenThrow(GameRuleViolationException.gameNotFound(404));

        mockMvc.perform(get("/api/games/404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("game_not_found"));
    }

    @Test
    void gameCardsIncludeDecodedCards() throws Exception {
        Card card = CardCodec.toCard(4021, CardCatalog.defaults());
        when(gameQueryService.getGameCards(1L)).thenReturn(List.of(4021));
        when(gameQueryService.getDecodedGameCards(1L)).thenReturn(List.of(card));

        mockMvc.perform(get("/api/games/1/cards"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.identifiers[0]").value(4021))
                .andExpect(jsonPath("$.cards[0].assetSymbol").value("ETH"))
                .andExpect(jsonPath("$.cards[0].predictionType").value("PRICE_ABOVE"))
                .andExpect(jsonPath("$.cards[0].targetBps").value(1000));
    }

    @Test
    void predictionResultDefaultsToUnresolved() throws Exception {
        when(gameQueryService.getPredictionResult(1L, 21)).thenReturn(PredictionResult.unresolved(21));

        mockMvc.perform(get("/api/games/1/predictions/21"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resolved").value(false))
                .andExpect(jsonPath("$.pointsEarned").value(0));
    }

    @Test
    void nextIdAndConfigAreExposed() throws Exception {
        when(gameQueryService.getNextGameId()).thenReturn(3L);

        mockMvc.perform(get("/api/games/next-id"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nextGameId").value(3));
        mockMvc.perform(get("/api/games/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.selectionSize").value(3))
                .andExpect(jsonPath("$.cardSetSize").value(10))
                .andExpect(jsonPath("$.resolutionDurationSeconds").value(600))
                .andExpect(jsonPath("$.percentageChangePoints").value(20));
    }
}
