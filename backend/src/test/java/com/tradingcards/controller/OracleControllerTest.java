package com.tradingcards.controller;

import com.tradingcards.oracle.PriceOracle;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(OracleController.class)
class OracleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PriceOracle priceOracle;

    @Test
    void quotesFeeForSubmittedUpdates() throws Exception {
        when(priceOracle.getUpdateFee(any())).thenReturn(BigInteger.valueOf(2));

        mockMvc.perform(post("/api/oracle/update-fee")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "updates": [
                                    {"id": "0xaa", "price": {"price": 1, "expo": 0, "publish_time": 1}},
                                    {"id": "0xbb", "price": {"price": 2, "expo": 0, "publish_time": 1}}
                                  ]
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updateCount").value(2))
                .andExpect(jsonPath("$.feeWei").value(2));
    }

    @Test
    void updatesWithoutPriceAreRejected() throws Exception {
        mockMvc.perform(post("/api/oracle/update-fee")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"updates\": [{\"id\": \"0xaa\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"));
    }
}
