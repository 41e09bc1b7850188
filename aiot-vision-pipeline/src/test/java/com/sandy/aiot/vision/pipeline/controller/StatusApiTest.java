package com.sandy.aiot.vision.pipeline.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class StatusApiTest {
    @Autowired MockMvc mockMvc;

    @Test
    void statusReportsRuntimeAndHealth() throws Exception {
        mockMvc.perform(get("/pipeline/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running", is(true)))
                .andExpect(jsonPath("$.accepting", is(true)))
                .andExpect(jsonPath("$.workers", is(2)))
                .andExpect(jsonPath("$.systemHealth", both(greaterThanOrEqualTo(0.0)).and(lessThanOrEqualTo(100.0))))
                .andExpect(jsonPath("$.counters.READINGS_ACCEPTED", greaterThanOrEqualTo(0)));
    }

    @Test
    void equipmentStatusUpdates() throws Exception {
        mockMvc.perform(put("/pipeline/api/equipment/eq-1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"ONLINE\"}"))
                .andExpect(jsonPath("$.success", is(true)));
        mockMvc.perform(put("/pipeline/api/equipment/ghost/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"MAINTENANCE\"}"))
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.message", is("Equipment not found")));
        mockMvc.perform(put("/pipeline/api/equipment/eq-1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(jsonPath("$.message", is("status is required")));
    }

    @Test
    void scorerBindingsCanBeChanged() throws Exception {
        mockMvc.perform(get("/pipeline/api/scorers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.defaultBinding.modelId", is("zscore-test")));

        mockMvc.perform(put("/pipeline/api/scorers/LATHE")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelId\":\"iforest-lathe\",\"type\":\"ENSEMBLE\"}"))
                .andExpect(jsonPath("$.success", is(true)));
        mockMvc.perform(get("/pipeline/api/scorers"))
                .andExpect(jsonPath("$.bindings.LATHE.type", is("ENSEMBLE")));
        mockMvc.perform(delete("/pipeline/api/scorers/LATHE"))
                .andExpect(jsonPath("$.success", is(true)));
        mockMvc.perform(delete("/pipeline/api/scorers/LATHE"))
                .andExpect(jsonPath("$.success", is(false)));
    }

    @Test
    void invalidConfigIsRefused() throws Exception {
        mockMvc.perform(put("/pipeline/api/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rules\":[{\"id\":\"\"}]}"))
                .andExpect(jsonPath("$.success", is(false)));
        mockMvc.perform(get("/pipeline/api/rules"))
                .andExpect(jsonPath("$[*].id", hasItem("load-high")));
    }
}
