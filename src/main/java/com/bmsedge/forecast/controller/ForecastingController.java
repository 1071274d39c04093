package com.bmsedge.forecast.controller;

import com.bmsedge.forecast.dto.ForecastRequest;
import com.bmsedge.forecast.dto.PeakAnalysisRequest;
import com.bmsedge.forecast.exception.InvalidInputException;
import com.bmsedge.forecast.model.DataPoint;
import com.bmsedge.forecast.model.ForecastResult;
import com.bmsedge.forecast.model.PeakAnalysisResult;
import com.bmsedge.forecast.model.SeasonalAnalysisPreview;
import com.bmsedge.forecast.model.SeasonalTrendsResult;
import com.bmsedge.forecast.service.ForecastingService;
import com.bmsedge.forecast.util.SeriesInputAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/forecasting")
@CrossOrigin(origins = "*")
public class ForecastingController {

    @Autowired
    private ForecastingService forecastingService;

    @Autowired
    private ObjectMapper objectMapper;

    @Value("${forecasting.default-history-days:365}")
    private int defaultHistoryDays = 365;

    @Value("${forecasting.default-forecast-days:30}")
    private int defaultForecastDays = 30;

    @Value("${forecasting.max-forecast-days:365}")
    private int maxForecastDays = 365;

    @Value("${forecasting.max-history-days:1825}")
    private int maxHistoryDays = 1825;

    @Value("${forecasting.anomaly-threshold:1.5}")
    private double defaultThreshold = 1.5;

    /**
     * Seasonal trends with forecasting over a generated history
     */
    @GetMapping("/seasonal-trends")
    public ResponseEntity<Map<String, Object>> getSeasonalTrends(
            @RequestParam(required = false) Integer days,
            @RequestParam(required = false) Integer forecastDays) {

        int historyDays = resolveHistoryDays(days);
        int horizon = resolveForecastDays(forecastDays);

        SeasonalTrendsResult result = forecastingService.seasonalTrendsWithForecast(historyDays, horizon);
        return ResponseEntity.ok(createSuccessResponse(result));
    }

    /**
     * Forecast for caller-supplied data
     */
    @PostMapping("/forecast")
    public ResponseEntity<Map<String, Object>> generateForecast(@Valid @RequestBody ForecastRequest request) {
        List<DataPoint> data = SeriesInputAdapter.fromJson(request.getData());
        int horizon = resolveForecastDays(request.getForecastPeriod());

        ForecastResult result = forecastingService.forecast(data, horizon);
        return ResponseEntity.ok(createSuccessResponse(result));
    }

    /**
     * Peaks and troughs in caller-supplied data
     */
    @PostMapping("/peak-analysis")
    public ResponseEntity<Map<String, Object>> analyzePeaks(@Valid @RequestBody PeakAnalysisRequest request) {
        List<DataPoint> data = SeriesInputAdapter.fromJson(request.getData());
        double threshold = request.getThreshold() != null ? request.getThreshold() : defaultThreshold;

        PeakAnalysisResult result = forecastingService.analyzePeaks(data, threshold);
        return ResponseEntity.ok(createSuccessResponse(result));
    }

    /**
     * Query-string form of peak analysis: data is a JSON array in the "data" parameter
     */
    @GetMapping("/peak-analysis")
    public ResponseEntity<Map<String, Object>> analyzePeaksFromQuery(
            @RequestParam(required = false) String data,
            @RequestParam(required = false) Double threshold) {

        List<DataPoint> points = SeriesInputAdapter.fromJson(data, objectMapper);
        PeakAnalysisResult result = forecastingService.analyzePeaks(points,
                threshold != null ? threshold : defaultThreshold);
        return ResponseEntity.ok(createSuccessResponse(result));
    }

    /**
     * Month-of-year profile of a generated history
     */
    @GetMapping("/seasonal-analysis")
    public ResponseEntity<Map<String, Object>> getSeasonalAnalysis(@RequestParam(required = false) Integer days) {
        SeasonalAnalysisPreview preview = forecastingService.seasonalAnalysisPreview(resolveHistoryDays(days));
        return ResponseEntity.ok(createSuccessResponse(preview));
    }

    private int resolveHistoryDays(Integer days) {
        if (days == null) return defaultHistoryDays;
        if (days < 1 || days > maxHistoryDays) {
            throw new InvalidInputException("Days must be between 1 and " + maxHistoryDays);
        }
        return days;
    }

    private int resolveForecastDays(Integer forecastDays) {
        if (forecastDays == null) return defaultForecastDays;
        if (forecastDays < 0 || forecastDays > maxForecastDays) {
            throw new InvalidInputException("Forecast period must be between 0 and " + maxForecastDays);
        }
        return forecastDays;
    }

    private Map<String, Object> createSuccessResponse(Object data) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("data", data);
        response.put("timestamp", LocalDateTime.now());
        return response;
    }
}
