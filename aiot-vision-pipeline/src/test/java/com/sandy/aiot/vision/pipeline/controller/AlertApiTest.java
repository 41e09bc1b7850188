package com.sandy.aiot.vision.pipeline.controller;

import com.sandy.aiot.vision.pipeline.model.AlertSnapshot;
import com.sandy.aiot.vision.pipeline.service.alert.AlertRuleEngine;
import com.sandy.aiot.vision.pipeline.support.Await;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AlertApiTest {
    @Autowired MockMvc mockMvc;
    @Autowired AlertRuleEngine alertRuleEngine;

    @AfterEach
    void resolveOpenAlerts() {
        for (AlertSnapshot a : alertRuleEngine.openAlerts()) {
            alertRuleEngine.resolve(a.getId(), "cleanup", null);
        }
    }

    @Test
    void statsEndpointReturnsStructure() throws Exception {
        mockMvc.perform(get("/pipeline/api/alerts/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeCount", greaterThanOrEqualTo(0)))
                .andExpect(jsonPath("$.recent24hCount", greaterThanOrEqualTo(0)))
                .andExpect(jsonPath("$.hourStats", hasSize(12)))
                .andExpect(jsonPath("$.hourStats[0].hour", matchesRegex("\\d{2}:00")))
                .andExpect(jsonPath("$.severityActive", notNullValue()))
                .andExpect(jsonPath("$.severityRecent24h", notNullValue()));
    }

    @Test
    void unknownAlertIsReported() throws Exception {
        mockMvc.perform(post("/pipeline/api/alerts/987654/ack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"op\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.message", is("Alert not found")));
        mockMvc.perform(get("/pipeline/api/alerts/987654"))
                .andExpect(status().isNotFound());
    }

    @Test
    void acknowledgeAnnotateAndResolveViaApi() throws Exception {
        mockMvc.perform(post("/pipeline/api/readings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sensorId\":\"s-load\",\"value\":180.0}"))
                .andExpect(status().isOk());
        assertTrue(Await.until(() -> loadAlert().isPresent(), Duration.ofSeconds(5)));
        long id = loadAlert().orElseThrow().getId();

        mockMvc.perform(get("/pipeline/api/alerts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].ruleId", hasItem("load-high")));

        mockMvc.perform(post("/pipeline/api/alerts/" + id + "/ack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"op\"}"))
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.data.state", is("ACKNOWLEDGED")))
                .andExpect(jsonPath("$.data.acknowledgedBy", is("op")));

        mockMvc.perform(post("/pipeline/api/alerts/" + id + "/ack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"op\"}"))
                .andExpect(jsonPath("$.success", is(false)));

        mockMvc.perform(post("/pipeline/api/alerts/" + id + "/annotate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"author\":\"op\",\"text\":\"checked hydraulics\"}"))
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.data.annotations", hasSize(1)));

        mockMvc.perform(post("/pipeline/api/alerts/" + id + "/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"op\"}"))
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.data.state", is("RESOLVED")));

        mockMvc.perform(get("/pipeline/api/alerts/recent").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(lessThanOrEqualTo(5))))
                .andExpect(jsonPath("$[*].id", hasItem((int) id)));
    }

    private Optional<AlertSnapshot> loadAlert() {
        return alertRuleEngine.openAlerts().stream().filter(a -> a.getRuleId().equals("load-high")).findFirst();
    }
}
