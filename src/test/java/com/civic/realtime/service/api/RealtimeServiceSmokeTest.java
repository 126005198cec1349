package com.civic.realtime.service.api;

import com.civic.realtime.service.api.dto.ChangeEventRequest;
import com.civic.realtime.service.model.ChangeEventKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Smoke tests for Civic Realtime Service.
 *
 * Tests basic functionality of all endpoints.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class RealtimeServiceSmokeTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void contextLoads() {
        // Context loads successfully
    }

    @Test
    void healthEndpointReportsRealtimeConnection() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(jsonPath("$.status").exists())
                .andExpect(jsonPath("$.components.realtimeConnection.details.state").exists());
    }

    @Test
    void swaggerUiAvailable() throws Exception {
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().is3xxRedirection());
    }

    @Test
    void statusEndpointWorks() throws Exception {
        mockMvc.perform(get("/realtime/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.state").exists())
                .andExpect(jsonPath("$.data.subscriptions").isArray());
    }

    @Test
    void metricsEndpointWorks() throws Exception {
        mockMvc.perform(get("/realtime/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.totalEvents").isNumber());
    }

    @Test
    void metricsResetReturnsSnapshot() throws Exception {
        mockMvc.perform(post("/realtime/metrics/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.capturedAt").exists());
    }

    @Test
    void publishChange_validRequest_returns202() throws Exception {
        ChangeEventRequest request = ChangeEventRequest.builder()
                .kind(ChangeEventKind.INSERT)
                .table("smoke_votes")
                .newRecord(Map.of("id", "v1", "choice", "yes"))
                .build();

        mockMvc.perform(post("/realtime/changes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.table").value("smoke_votes"))
                .andExpect(jsonPath("$.data.deliveries").value(0));
    }

    @Test
    void publishChange_missingTable_returns400() throws Exception {
        ChangeEventRequest request = ChangeEventRequest.builder()
                .kind(ChangeEventKind.INSERT)
                .newRecord(Map.of("id", "v1"))
                .build();

        mockMvc.perform(post("/realtime/changes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void publishChange_deleteWithoutPreImage_returns400() throws Exception {
        ChangeEventRequest request = ChangeEventRequest.builder()
                .kind(ChangeEventKind.DELETE)
                .table("smoke_votes")
                .build();

        mockMvc.perform(post("/realtime/changes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void unknownPathReturns404() throws Exception {
        mockMvc.perform(get("/realtime/nothing-here"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }
}
