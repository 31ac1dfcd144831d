package com.wirefeed.backend.controller;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.wirefeed.backend.scheduler.ScrapingJobService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ScrapingController.class)
class ScrapingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScrapingJobService jobService;

    @Test
    @DisplayName("should accept a manual run")
    void shouldAcceptRun() throws Exception {
        when(jobService.startManualRun(7)).thenReturn(true);

        mockMvc.perform(post("/api/scraping/run").param("daysBack", "7"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.daysBack").value(7));
    }

    @Test
    @DisplayName("should answer 409 while a job is in progress")
    void shouldRejectWhileRunning() throws Exception {
        when(jobService.startManualRun(1)).thenReturn(false);

        mockMvc.perform(post("/api/scraping/run"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("A scraping job is already in progress"));
    }

    @Test
    @DisplayName("should reject a non-positive day count")
    void shouldRejectInvalidDays() throws Exception {
        mockMvc.perform(post("/api/scraping/run").param("daysBack", "0"))
                .andExpect(status().isBadRequest());

        verify(jobService, never()).startManualRun(anyInt());
    }
}
