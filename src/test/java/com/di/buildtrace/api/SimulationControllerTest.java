package com.di.buildtrace.api;

import com.di.buildtrace.simulation.JobSimulator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("SimulationController Tests")
class SimulationControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcSupport.mockMvc(new SimulationController(new JobSimulator(Clock.systemUTC())));
    }

    @Test
    @DisplayName("Returns a payload shaped like the ingestion request")
    void testSimulate() throws Exception {
        mockMvc.perform(post("/simulate").param("jobs", "3").param("baseObjects", "10").param("seed", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[0].job_id").value(1))
                .andExpect(jsonPath("$[2].job_id").value(3))
                .andExpect(jsonPath("$[0].latency_ms").isNumber())
                .andExpect(jsonPath("$[0].state").isMap());
    }

    @Test
    @DisplayName("Out-of-range parameters are rejected")
    void testLimits() throws Exception {
        mockMvc.perform(post("/simulate").param("jobs", "0")).andExpect(status().isBadRequest());
        mockMvc.perform(post("/simulate").param("jobs", String.valueOf(SimulationController.MAX_JOBS + 1)))
                .andExpect(status().isBadRequest());
    }
}
