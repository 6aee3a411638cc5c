package com.tradingcards.controller;

import com.tradingcards.controller.dto.GameResponses;
import com.tradingcards.service.GameQueryService;
import com.tradingcards.service.PlayerAddresses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/players")
public class PlayerController {

    private final GameQueryService gameQueryService;

    public PlayerController(GameQueryService gameQueryService) {
        this.gameQueryService = gameQueryService;
    }

    @GetMapping("/{player}/score")
    public ResponseEntity<GameResponses.Score> getPlayerScore(@PathVariable String player) {
        String normalized = PlayerAddresses.normalize(player);
        return ResponseEntity.ok(GameResponses.Score.from(
                normalized,
                gameQueryService.getPlayerScore(normalized),
                gameQueryService.getActiveGameId(normalized).orElse(null)
        ));
    }
}
