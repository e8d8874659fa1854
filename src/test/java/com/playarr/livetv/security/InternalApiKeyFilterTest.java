package com.playarr.livetv.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InternalApiKeyFilterTest {

    private static final String VALID_API_KEY = "test-api-key-12345";

    @Mock
    private HttpServletRequest request;

    @Mock
    private HttpServletResponse response;

    @Mock
    private FilterChain filterChain;

    private StringWriter responseBody;

    @BeforeEach
    void setUp() throws Exception {
        responseBody = new StringWriter();
        lenient().when(response.getWriter()).thenReturn(new PrintWriter(responseBody));
        lenient().when(request.getRequestURI()).thenReturn("/internal/livetv/sync");
    }

    @Nested
    class ShouldNotFilterTests {

        @Test
        void shouldNotFilter_PublicLiveTvPath_ReturnsTrue() {
            // Given
            when(request.getRequestURI()).thenReturn("/api/livetv/users/alice/channels");

            // When / Then
            assertThat(new InternalApiKeyFilter(VALID_API_KEY).shouldNotFilter(request)).isTrue();
        }

        @Test
        void shouldNotFilter_InternalPath_ReturnsFalse() {
            assertThat(new InternalApiKeyFilter(VALID_API_KEY).shouldNotFilter(request)).isFalse();
        }
    }

    @Nested
    class DoFilterTests {

        @Test
        void doFilterInternal_WithValidKey_ContinuesChain() throws Exception {
            // Given
            when(request.getHeader(InternalApiKeyFilter.API_KEY_HEADER)).thenReturn(VALID_API_KEY);

            // When
            new InternalApiKeyFilter(VALID_API_KEY).doFilterInternal(request, response, filterChain);

            // Then
            verify(filterChain).doFilter(request, response);
            verify(response, never()).setStatus(anyInt());
        }

        @Test
        void doFilterInternal_WithMissingKey_Returns401() throws Exception {
            // Given
            when(request.getHeader(InternalApiKeyFilter.API_KEY_HEADER)).thenReturn(null);

            // When
            new InternalApiKeyFilter(VALID_API_KEY).doFilterInternal(request, response, filterChain);

            // Then
            verify(response).setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            verify(filterChain, never()).doFilter(any(), any());
            assertThat(responseBody.toString()).contains("Missing API key");
        }

        @Test
        void doFilterInternal_WithWrongKey_Returns401() throws Exception {
            // Given
            when(request.getHeader(InternalApiKeyFilter.API_KEY_HEADER)).thenReturn("wrong-key");

            // When
            new InternalApiKeyFilter(VALID_API_KEY).doFilterInternal(request, response, filterChain);

            // Then
            verify(response).setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            verify(filterChain, never()).doFilter(any(), any());
            assertThat(responseBody.toString()).contains("Invalid API key");
        }

        @Test
        void doFilterInternal_WithNoConfiguredKey_RefusesEveryRequest() throws Exception {
            // When
            new InternalApiKeyFilter("").doFilterInternal(request, response, filterChain);

            // Then
            verify(response).setStatus(HttpServletResponse.SC_SERVICE_UNAVAILABLE);
            verify(filterChain, never()).doFilter(any(), any());
        }
    }
}
