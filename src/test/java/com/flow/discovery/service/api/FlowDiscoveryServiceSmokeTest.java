package com.flow.discovery.service.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flow.discovery.service.api.dto.DiscoveryRequest;
import com.flow.discovery.service.engine.Algorithm;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Smoke tests for Flow Discovery Service.
 *
 * Tests basic functionality of all endpoints.
 */
@SpringBootTest
@AutoConfigureMockMvc
class FlowDiscoveryServiceSmokeTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void contextLoads() {
        // Context loads successfully
    }

    @Test
    void healthEndpointWorks() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.miningCache.details.totalEntries").exists());
    }

    @Test
    void swaggerUiAvailable() throws Exception {
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().is3xxRedirection());
    }

    @Test
    void listAlgorithms_returnsAllMiners() throws Exception {
        mockMvc.perform(get("/discovery/algorithms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.length()").value(3))
                .andExpect(jsonPath("$.data[?(@.name == 'INFREQUENT')].defaults.noiseThreshold").value(0.2))
                .andExpect(jsonPath("$.data[?(@.name == 'APPROXIMATE')].defaults.sampleSize").value(1000));
    }

    @Test
    void discover_validRequest_returns200() throws Exception {
        DiscoveryRequest request = DiscoveryRequest.builder()
                .traces(List.of(
                        List.of("register", "check", "pay"),
                        List.of("register", "check", "pay")))
                .build();

        mockMvc.perform(post("/discovery")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.algorithm").value("INDUCTIVE"))
                .andExpect(jsonPath("$.data.treeText").value("SEQUENCE(register, check, pay)"))
                .andExpect(jsonPath("$.data.tree.type").value("SEQUENCE"))
                .andExpect(jsonPath("$.data.tree.children.length()").value(3))
                .andExpect(jsonPath("$.data.activities.pay.frequency").value(2));
    }

    @Test
    void discover_missingLog_returns400() throws Exception {
        DiscoveryRequest request = DiscoveryRequest.builder()
                .algorithm(Algorithm.APPROXIMATE)
                .build();

        mockMvc.perform(post("/discovery")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details").value("traces or variants are required"));
    }

    @Test
    void clearCache_returns200() throws Exception {
        mockMvc.perform(delete("/discovery/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data").value("Cache cleared"));
    }

    @Test
    void unknownPath_returns404() throws Exception {
        mockMvc.perform(get("/discovery/unknown"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }
}
