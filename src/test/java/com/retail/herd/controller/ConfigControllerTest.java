package com.retail.herd.controller;

import com.retail.herd.config.TransportConfig;
import com.retail.herd.config.TrendDetectionConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
@Import({TrendDetectionConfig.class, TransportConfig.class})
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void getConfig_returnsEffectiveDefaults() throws Exception {
        mockMvc.perform(get("/api/v1/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.detection.bucketWidth").value("PT10S"))
                .andExpect(jsonPath("$.detection.bucketsPerWindow").value(60))
                .andExpect(jsonPath("$.detection.minSamples").value(6))
                .andExpect(jsonPath("$.detection.upThreshold").value(3.0))
                .andExpect(jsonPath("$.detection.debounceCount").value(2))
                .andExpect(jsonPath("$.concurrency.subscriberOverflowPolicy").value("DROP_OLDEST"))
                .andExpect(jsonPath("$.transport.maxAttempts").value(10));
    }

    @Test
    void config_isReadOnly() throws Exception {
        mockMvc.perform(put("/api/v1/config"))
                .andExpect(status().isMethodNotAllowed());
    }
}
