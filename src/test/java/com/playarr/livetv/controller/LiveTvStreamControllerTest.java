package com.playarr.livetv.controller;

import com.playarr.livetv.exception.ResourceNotFoundException;
import com.playarr.livetv.exception.UnauthorizedException;
import com.playarr.livetv.service.LiveTvService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class LiveTvStreamControllerTest {

    @Mock
    private LiveTvService liveTvService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new LiveTvStreamController(liveTvService)).build();
    }

    @Test
    void stream_WithValidKey_RedirectsToUpstream() throws Exception {
        // Given
        when(liveTvService.resolveStreamUrl("k-1", "bbc1")).thenReturn("http://upstream/live/bbc1.ts");

        // When / Then
        mockMvc.perform(get("/api/livetv/stream/bbc1").param("api_key", "k-1"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "http://upstream/live/bbc1.ts"));
    }

    @Test
    void stream_WithUnknownKey_Returns401() throws Exception {
        // Given
        when(liveTvService.resolveStreamUrl("bad", "bbc1")).thenThrow(new UnauthorizedException("Invalid API key"));

        // When / Then
        mockMvc.perform(get("/api/livetv/stream/bbc1").param("api_key", "bad"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
    }

    @Test
    void stream_WithUnknownChannel_Returns404() throws Exception {
        // Given
        when(liveTvService.resolveStreamUrl("k-1", "gone")).thenThrow(new ResourceNotFoundException("Channel not found: gone"));

        // When / Then
        mockMvc.perform(get("/api/livetv/stream/gone").param("api_key", "k-1"))
                .andExpect(status().isNotFound());
    }

    @Test
    void stream_WithoutKey_Returns400() throws Exception {
        mockMvc.perform(get("/api/livetv/stream/bbc1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verifyNoInteractions(liveTvService);
    }
}
