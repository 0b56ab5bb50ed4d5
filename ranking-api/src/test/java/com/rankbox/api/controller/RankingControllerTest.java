package com.rankbox.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rankbox.api.dto.ResolveRequest;
import com.rankbox.api.service.RankingSessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RankingControllerTest {

    private static final String FOUR_ITEMS = """
            {"items": [
              {"id": "m1", "title": "Heat", "year": "1995"},
              {"id": "m2", "title": "Ronin", "year": "1998"},
              {"id": "m3", "title": "Collateral", "year": "2004"},
              {"id": "m4", "title": "Drive", "year": "2011"}
            ], "mode": "quick"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private RankingSessionService sessionService;

    @BeforeEach
    void resetSession() {
        sessionService.endSession();
    }

    private void startSession() throws Exception {
        mockMvc.perform(post("/api/ranking/session")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(FOUR_ITEMS))
                .andExpect(status().isCreated());
    }

    private List<String> currentIds() throws Exception {
        MvcResult result = mockMvc.perform(get("/api/ranking/selection"))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        List<String> ids = new ArrayList<>();
        body.get("items").forEach(item -> ids.add(item.get("id").asText()));
        return ids;
    }

    // ============ SESSION ============

    @Test
    void endpointsWithoutSessionReturnNotFound() throws Exception {
        mockMvc.perform(get("/api/ranking/selection"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NO_ACTIVE_SESSION"))
                .andExpect(jsonPath("$.path").value("/api/ranking/selection"));

        mockMvc.perform(get("/api/ranking/results"))
                .andExpect(status().isNotFound());
    }

    @Test
    void startSessionUsesTheRequestedMode() throws Exception {
        mockMvc.perform(post("/api/ranking/session")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(FOUR_ITEMS))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.itemCount").value(4))
                .andExpect(jsonPath("$.maxComparisons").value(20))
                .andExpect(jsonPath("$.mode").value("quick"))
                .andExpect(jsonPath("$.sessionId").isNotEmpty());

        mockMvc.perform(get("/api/ranking/session"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.itemCount").value(4));
    }

    @Test
    void unknownModeIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/ranking/session")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(FOUR_ITEMS.replace("quick", "leisurely")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void nullItemIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/ranking/session")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [{\"id\": \"m1\"}, null, {\"id\": \"m2\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void malformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/ranking/session")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_BODY"));
    }

    @Test
    void deleteSessionDiscardsIt() throws Exception {
        startSession();

        mockMvc.perform(delete("/api/ranking/session"))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/ranking/progress"))
                .andExpect(status().isNotFound());
    }

    // ============ COMPARISONS ============

    @Test
    void groupChoiceAdvancesTheSession() throws Exception {
        startSession();
        List<String> ids = currentIds();
        assertThat(ids).hasSize(4);

        mockMvc.perform(get("/api/ranking/selection"))
                .andExpect(jsonPath("$.phase").value("BROAD_GROUPS"))
                .andExpect(jsonPath("$.finished").value(false))
                .andExpect(jsonPath("$.comparisons").value(0));

        mockMvc.perform(post("/api/ranking/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ResolveRequest(ids.get(0), null, ids))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.comparisons").value(3))
                .andExpect(jsonPath("$.maxComparisons").value(20));

        mockMvc.perform(get("/api/ranking/progress"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stats.comparisons").value(3))
                .andExpect(jsonPath("$.progress").value("15%"))
                .andExpect(jsonPath("$.finished").value(false));

        mockMvc.perform(get("/api/ranking/results"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(4))
                .andExpect(jsonPath("$[0].rank").value(1));
    }

    @Test
    void resolveWithoutWinnerIsRejected() throws Exception {
        startSession();
        List<String> ids = currentIds();

        mockMvc.perform(post("/api/ranking/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ResolveRequest(null, ids.get(1), ids))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void undoWithNothingToUndoReturnsNoContent() throws Exception {
        startSession();

        mockMvc.perform(post("/api/ranking/undo"))
                .andExpect(status().isNoContent());
        mockMvc.perform(post("/api/ranking/undo-decision"))
                .andExpect(status().isNoContent());
    }

    @Test
    void undoDecisionRestoresTheGroup() throws Exception {
        startSession();
        List<String> ids = currentIds();
        mockMvc.perform(post("/api/ranking/resolve")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new ResolveRequest(ids.get(3), null, ids))));

        mockMvc.perform(post("/api/ranking/undo-decision"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.comparisons").value(0))
                .andExpect(jsonPath("$.items.length()").value(4));
    }

    @Test
    void finishReturnsStandingsAndStopsSelection() throws Exception {
        startSession();
        List<String> ids = currentIds();
        mockMvc.perform(post("/api/ranking/resolve")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new ResolveRequest(ids.get(2), null, ids))));

        mockMvc.perform(post("/api/ranking/finish"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].item.id").value(ids.get(2)))
                .andExpect(jsonPath("$[0].wins").value(3));

        mockMvc.perform(get("/api/ranking/selection"))
                .andExpect(jsonPath("$.finished").value(true))
                .andExpect(jsonPath("$.items.length()").value(0));
        mockMvc.perform(post("/api/ranking/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ResolveRequest(ids.get(0), ids.get(1), null))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SESSION_STATE"));
    }

    // ============ READS ============

    @Test
    void confidenceForUnknownItemIsNotFound() throws Exception {
        startSession();

        mockMvc.perform(get("/api/ranking/items/m1/confidence"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.itemId").value("m1"))
                .andExpect(jsonPath("$.belowMinimum").value(true));
        mockMvc.perform(get("/api/ranking/items/m9/confidence"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void modesNeedAnItemCount() throws Exception {
        mockMvc.perform(get("/api/ranking/modes").param("itemCount", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[1].id").value("balanced"))
                .andExpect(jsonPath("$[1].comparisons").value(64));

        mockMvc.perform(get("/api/ranking/modes"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_PARAMETER"));
        mockMvc.perform(get("/api/ranking/modes").param("itemCount", "ten"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PARAMETER"));
    }

    @Test
    void healthReportsSessionState() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.activeSession").value(false));

        startSession();

        mockMvc.perform(get("/api/health"))
                .andExpect(jsonPath("$.activeSession").value(true))
                .andExpect(jsonPath("$.comparisons").value(0));
    }
}
