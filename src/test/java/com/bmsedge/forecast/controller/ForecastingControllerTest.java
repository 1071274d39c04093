package com.bmsedge.forecast.controller;

import com.bmsedge.forecast.exception.GlobalExceptionHandler;
import com.bmsedge.forecast.exception.InvalidInputException;
import com.bmsedge.forecast.model.ForecastResult;
import com.bmsedge.forecast.model.PeakAnalysisResult;
import com.bmsedge.forecast.service.ForecastingService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.mockito.Spy;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for ForecastingController with a mocked service
 */
class ForecastingControllerTest {

    @Mock
    private ForecastingService forecastingService;

    @Spy
    private ObjectMapper objectMapper = new ObjectMapper();

    @InjectMocks
    private ForecastingController forecastingController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(forecastingController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should forecast posted data with the requested period")
    void testForecastEndpoint() throws Exception {
        // Arrange
        when(forecastingService.forecast(anyList(), eq(5)))
                .thenReturn(ForecastResult.degraded(Collections.emptyList()));

        // Act & Assert
        mockMvc.perform(post("/api/forecasting/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":[{\"date\":\"2024-01-01\",\"value\":10},"
                                + "{\"date\":\"2024-01-02\",\"actual\":12}],\"forecastPeriod\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.trendDirection").value("stable"))
                .andExpect(jsonPath("$.data.regression").doesNotExist());

        verify(forecastingService).forecast(argThat(list -> list.size() == 2), eq(5));
    }

    @Test
    @DisplayName("Should default the forecast period to thirty days")
    void testForecastDefaultPeriod() throws Exception {
        when(forecastingService.forecast(anyList(), anyInt()))
                .thenReturn(ForecastResult.degraded(Collections.emptyList()));

        mockMvc.perform(post("/api/forecasting/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":[]}"))
                .andExpect(status().isOk());

        verify(forecastingService).forecast(anyList(), eq(30));
    }

    @Test
    @DisplayName("Should return 400 for non-numeric values without calling the service")
    void testForecastRejectsNonNumericValue() throws Exception {
        mockMvc.perform(post("/api/forecasting/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":[{\"date\":\"2024-01-01\",\"value\":\"abc\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Invalid Input"));

        verifyNoInteractions(forecastingService);
    }

    @Test
    @DisplayName("Should return 400 when data is missing or not an array")
    void testForecastRejectsBadShape() throws Exception {
        mockMvc.perform(post("/api/forecasting/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"forecastPeriod\":5}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/forecasting/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":\"2024-01-01\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(forecastingService);
    }

    @Test
    @DisplayName("Should map service input errors to 400")
    void testServiceInvalidInput() throws Exception {
        when(forecastingService.forecast(anyList(), anyInt()))
                .thenThrow(new InvalidInputException("Duplicate date in series: 2024-01-01"));

        mockMvc.perform(post("/api/forecasting/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":[{\"date\":\"2024-01-01\",\"value\":1},{\"date\":\"2024-01-01\",\"value\":2}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Duplicate date in series: 2024-01-01"));
    }

    @Test
    @DisplayName("Should map unexpected failures to a generic 500")
    void testUnexpectedFailure() throws Exception {
        when(forecastingService.seasonalTrendsWithForecast(anyInt(), anyInt()))
                .thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/api/forecasting/seasonal-trends"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Internal Server Error"));

        verify(forecastingService).seasonalTrendsWithForecast(365, 30);
    }

    @Test
    @DisplayName("Should reject forecast periods beyond the configured maximum")
    void testSeasonalTrendsRejectsLongHorizon() throws Exception {
        mockMvc.perform(get("/api/forecasting/seasonal-trends").param("forecastDays", "1000"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(forecastingService);
    }

    @Test
    @DisplayName("Should analyse posted data with the default threshold")
    void testPeakAnalysisPost() throws Exception {
        when(forecastingService.analyzePeaks(anyList(), anyDouble()))
                .thenReturn(new PeakAnalysisResult(Collections.emptyList(), 12.5));

        mockMvc.perform(post("/api/forecasting/peak-analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":[{\"date\":\"2024-01-01\",\"value\":1}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.volatilityPercent").value(12.5))
                .andExpect(jsonPath("$.data.peakCount").value(0));

        verify(forecastingService).analyzePeaks(anyList(), eq(1.5));
    }

    @Test
    @DisplayName("Should analyse data passed as a JSON query parameter")
    void testPeakAnalysisQuery() throws Exception {
        when(forecastingService.analyzePeaks(anyList(), anyDouble()))
                .thenReturn(new PeakAnalysisResult(List.of(), 0.0));

        mockMvc.perform(get("/api/forecasting/peak-analysis")
                        .param("data", "[{\"date\":\"2024-01-01\",\"value\":1},{\"date\":\"2024-01-02\",\"value\":2}]")
                        .param("threshold", "2.0"))
                .andExpect(status().isOk());

        verify(forecastingService).analyzePeaks(argThat(list -> list.size() == 2), eq(2.0));
    }

    @Test
    @DisplayName("Should return 400 for invalid JSON in the query parameter")
    void testPeakAnalysisQueryInvalidJson() throws Exception {
        mockMvc.perform(get("/api/forecasting/peak-analysis").param("data", "{broken"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Data must be valid JSON"));

        mockMvc.perform(get("/api/forecasting/peak-analysis"))
                .andExpect(status().isBadRequest());
    }
}
