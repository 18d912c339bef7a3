package com.rebalance.backend.controller;

import com.jayway.jsonpath.JsonPath;
import com.rebalance.backend.service.risk.SystemGuardService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class TradeRunControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SystemGuardService systemGuardService;

    @AfterEach
    void clearHalt() {
        systemGuardService.clear();
    }

    @Test
    void createRunThenReuseIt() throws Exception {
        String payload = """
                {
                  "projectId": 9101,
                  "decisionSnapshotId": 3,
                  "mode": "PAPER",
                  "targetWeights": {"aaa": 0.5, "bbb": 0.25}
                }
                """;

        mockMvc.perform(post("/api/trade/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("QUEUED"))
                .andExpect(jsonPath("$.params.targetWeights.AAA").value(0.5));

        mockMvc.perform(post("/api/trade/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/trade/runs").param("projectId", "9101"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void rejectsInvalidRequests() throws Exception {
        mockMvc.perform(post("/api/trade/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\": 9102}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/trade/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\": 9102, \"mode\": \"LIVE\", \"targetWeights\": {\"AAA\": 0.5}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("live_confirm_token_required"));

        mockMvc.perform(get("/api/trade/runs/987654321"))
                .andExpect(status().isNotFound());
    }

    @Test
    void createOrderIsIdempotentOnClientOrderId() throws Exception {
        String payload = """
                {
                  "clientOrderId": "manual-9103-1",
                  "symbol": "AAA",
                  "side": "BUY",
                  "quantity": 5,
                  "orderType": "LMT",
                  "limitPrice": 10.5
                }
                """;

        mockMvc.perform(post("/api/trade/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("NEW"));

        mockMvc.perform(post("/api/trade/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/trade/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload.replace("\"quantity\": 5", "\"quantity\": 6")))
                .andExpect(status().isConflict());
    }

    @Test
    void directOrderNeedsHealthyBridgeAndCancelEndsIt() throws Exception {
        String payload = """
                {
                  "clientOrderId": "manual-9104-1",
                  "symbol": "BBB",
                  "side": "SELL",
                  "quantity": 3
                }
                """;

        mockMvc.perform(post("/api/trade/orders/direct")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("bridge_unreachable"));

        String created = mockMvc.perform(post("/api/trade/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        Number orderId = JsonPath.read(created, "$.id");

        mockMvc.perform(post("/api/trade/orders/" + orderId + "/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELED"));

        mockMvc.perform(get("/api/trade/orders").param("status", "parked"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void haltAndClearGuard() throws Exception {
        mockMvc.perform(post("/api/trade/guard/halt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"broker outage\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.halted").value(true))
                .andExpect(jsonPath("$.haltReason").value("broker outage"));

        mockMvc.perform(get("/api/trade/guard/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.halted").value(true));

        mockMvc.perform(post("/api/trade/guard/clear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.halted").value(false));

        mockMvc.perform(post("/api/trade/guard/halt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"\"}"))
                .andExpect(status().isBadRequest());
    }
}
