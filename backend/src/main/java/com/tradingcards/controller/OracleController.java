package com.tradingcards.controller;

import com.tradingcards.controller.dto.GameRequests;
import com.tradingcards.controller.dto.GameResponses;
import com.tradingcards.oracle.PriceEvidence;
import com.tradingcards.oracle.PriceOracle;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/oracle")
public class OracleController {

    private final PriceOracle priceOracle;

    public OracleController(PriceOracle priceOracle) {
        this.priceOracle = priceOracle;
    }

    /**
     * Fee a resolve call must carry for the given evidence.
     */
    @PostMapping("/update-fee")
    public ResponseEntity<GameResponses.UpdateFee> quoteUpdateFee(
            @Valid @RequestBody GameRequests.PriceEvidenceRequest request
    ) {
        PriceEvidence evidence = request.toEvidence();
        return ResponseEntity.ok(new GameResponses.UpdateFee(
                evidence.updates().size(), priceOracle.getUpdateFee(evidence)));
    }
}
