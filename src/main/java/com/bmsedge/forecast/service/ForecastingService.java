package com.bmsedge.forecast.service;

import com.bmsedge.forecast.engine.AnomalyDetector;
import com.bmsedge.forecast.engine.SeasonalProfile;
import com.bmsedge.forecast.engine.SyntheticSeriesGenerator;
import com.bmsedge.forecast.engine.TrendModel;
import com.bmsedge.forecast.engine.VolatilityEstimator;
import com.bmsedge.forecast.exception.InvalidInputException;
import com.bmsedge.forecast.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.*;
import java.util.stream.Collectors;

@Service
public class ForecastingService {

    private static final Logger logger = LoggerFactory.getLogger(ForecastingService.class);

    private static final double TREND_SLOPE_THRESHOLD = 0.1;
    private static final double HIGH_VOLATILITY_PERCENT = 50;
    private static final double MIN_CONFIDENCE = 0.5;
    private static final double CONFIDENCE_DECAY = 0.8;

    @Autowired
    private AnomalyDetector anomalyDetector;

    @Autowired
    private SyntheticSeriesGenerator seriesGenerator;

    @Value("${forecasting.preview-points:90}")
    private int previewPoints = 90;

    /**
     * Fit a linear trend to the history and project it {@code horizonDays} past the last date.
     * The caller's list is never modified.
     *
     * @param historicalSeries observations in any order, one per date
     * @param horizonDays      number of days to forecast, zero or more
     */
    public ForecastResult forecast(List<DataPoint> historicalSeries, int horizonDays) {
        if (horizonDays < 0) {
            throw new InvalidInputException("Forecast period must not be negative: " + horizonDays);
        }
        List<DataPoint> input = historicalSeries != null ? historicalSeries : Collections.emptyList();
        validatePoints(input);

        if (input.size() < 2) {
            logger.debug("Only {} data point(s) supplied, returning neutral forecast", input.size());
            return ForecastResult.degraded(input.stream()
                    .map(TimeSeriesPoint::observed)
                    .collect(Collectors.toList()));
        }

        List<DataPoint> sorted = new ArrayList<>(input);
        sorted.sort(Comparator.comparing(DataPoint::getDate));
        rejectDuplicateDates(sorted);

        int n = sorted.size();
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = sorted.get(i).getValue();
        }

        TrendModel regression = TrendModel.fitSequential(values);
        double volatility = VolatilityEstimator.volatilityPercent(values);
        TrendDirection trend = classifyTrend(regression.getSlope());

        List<TimeSeriesPoint> series = new ArrayList<>(n + horizonDays);

        // Historical points
        for (int i = 0; i < n; i++) {
            DataPoint point = sorted.get(i);
            double raw = regression.predict(i);
            series.add(new TimeSeriesPoint(
                    point.getDate(),
                    point.getValue(),
                    Math.max(0, raw),
                    SeasonalProfile.seasonalComponent(point.getDate(), point.getValue()),
                    raw,
                    confidenceAt(i, n),
                    false));
        }

        // Future points
        LocalDate lastDate = sorted.get(n - 1).getDate();
        for (int k = 1; k <= horizonDays; k++) {
            LocalDate futureDate = lastDate.plusDays(k);
            int futureIndex = n + k - 1;
            double raw = regression.predict(futureIndex);
            double predicted = Math.max(0, raw);
            series.add(new TimeSeriesPoint(
                    futureDate,
                    null,
                    predicted,
                    SeasonalProfile.seasonalComponent(futureDate, predicted),
                    raw,
                    confidenceAt(futureIndex, n),
                    true));
        }

        List<AnomalyAlert> anomalies = anomalyDetector.detect(series);
        double rSquared = rSquared(values, series.subList(0, n));
        double overallConfidence = Math.max(0, Math.min(1, 1 - volatility / 100));

        logger.info("Generated forecast: {} historical points, {} forecast days, trend={}, volatility={}%, anomalies={}",
                n, horizonDays, trend, String.format(Locale.US, "%.2f", volatility), anomalies.size());

        return new ForecastResult(series, anomalies, volatility, trend, overallConfidence,
                new RegressionStats(regression.getSlope(), regression.getIntercept(), rSquared));
    }

    /**
     * Confidence score for a point, decaying with its distance from the last historical index
     * and floored at 0.5. Points before and after the last observation decay alike.
     */
    public static double confidenceAt(int index, int totalLength) {
        if (totalLength < 1) {
            throw new IllegalArgumentException("Series length must be positive: " + totalLength);
        }
        double distance = Math.abs(index - (totalLength - 1));
        return Math.max(MIN_CONFIDENCE, 1 - (distance / totalLength) * CONFIDENCE_DECAY);
    }

    /**
     * Forecast a synthetic seasonal history and attach its month profile and recommendations.
     */
    public SeasonalTrendsResult seasonalTrendsWithForecast(int days, int horizonDays) {
        requirePositiveDays(days);
        logger.info("Generating seasonal trends: {} days of history, {} forecast days", days, horizonDays);

        List<DataPoint> history = seriesGenerator.generate(days);
        ForecastResult forecast = forecast(history, horizonDays);

        return new SeasonalTrendsResult(forecast, analyzeSeasonalPatterns(history), generateRecommendations(forecast));
    }

    /**
     * Average value per calendar month, normalised against the mean of the twelve monthly
     * averages. Months without data average to 0.
     */
    public SeasonalAnalysis analyzeSeasonalPatterns(List<DataPoint> data) {
        double[] monthlyTotals = new double[12];
        int[] monthlyCounts = new int[12];

        for (DataPoint point : data) {
            int month = point.getDate().getMonthValue() - 1;
            monthlyTotals[month] += point.getValue();
            monthlyCounts[month]++;
        }

        double[] monthlyAverages = new double[12];
        double sumOfAverages = 0;
        for (int m = 0; m < 12; m++) {
            monthlyAverages[m] = monthlyCounts[m] > 0 ? monthlyTotals[m] / monthlyCounts[m] : 0;
            sumOfAverages += monthlyAverages[m];
        }
        double overallAverage = sumOfAverages / 12;

        double[] seasonalFactors = new double[12];
        int peakMonth = 0;
        int lowMonth = 0;
        for (int m = 0; m < 12; m++) {
            seasonalFactors[m] = overallAverage != 0 ? monthlyAverages[m] / overallAverage : 0;
            if (monthlyAverages[m] > monthlyAverages[peakMonth]) peakMonth = m;
            if (monthlyAverages[m] < monthlyAverages[lowMonth]) lowMonth = m;
        }

        return new SeasonalAnalysis(monthlyAverages, overallAverage, seasonalFactors, peakMonth, lowMonth);
    }

    public List<Recommendation> generateRecommendations(ForecastResult result) {
        List<Recommendation> recommendations = new ArrayList<>();

        if (result.getTrendDirection() == TrendDirection.INCREASING) {
            recommendations.add(new Recommendation(
                    Recommendation.Type.OPPORTUNITY,
                    "Growth Trend Detected",
                    "Data shows an upward trend. Consider increasing inventory and marketing efforts.",
                    Recommendation.Priority.HIGH));
        } else if (result.getTrendDirection() == TrendDirection.DECREASING) {
            recommendations.add(new Recommendation(
                    Recommendation.Type.WARNING,
                    "Declining Trend",
                    "Data shows a downward trend. Consider reviewing strategy and reducing costs.",
                    Recommendation.Priority.HIGH));
        }

        if (result.getVolatilityPercent() > HIGH_VOLATILITY_PERCENT) {
            recommendations.add(new Recommendation(
                    Recommendation.Type.WARNING,
                    "High Volatility",
                    "Data shows high volatility. Consider implementing risk management strategies.",
                    Recommendation.Priority.MEDIUM));
        }

        long highPeaks = result.countHighSeverityAnomalies();
        if (highPeaks > 0) {
            recommendations.add(new Recommendation(
                    Recommendation.Type.OPPORTUNITY,
                    "Peak Opportunities",
                    highPeaks + " high-value peaks detected. Consider capitalizing on these periods.",
                    Recommendation.Priority.MEDIUM));
        }

        return recommendations;
    }

    /**
     * Standalone anomaly analysis of an externally supplied series.
     * Points are compared in date order, not in the order they were supplied.
     */
    public PeakAnalysisResult analyzePeaks(List<DataPoint> data, double threshold) {
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            throw new InvalidInputException("Threshold must be a positive number: " + threshold);
        }
        validatePoints(data);

        List<DataPoint> sorted = new ArrayList<>(data);
        sorted.sort(Comparator.comparing(DataPoint::getDate));

        List<TimeSeriesPoint> series = sorted.stream()
                .map(TimeSeriesPoint::observed)
                .collect(Collectors.toList());
        double[] values = sorted.stream().mapToDouble(DataPoint::getValue).toArray();

        PeakAnalysisResult result = new PeakAnalysisResult(
                anomalyDetector.detect(series, threshold),
                VolatilityEstimator.volatilityPercent(values));

        logger.info("Peak analysis over {} points: {} peaks, {} troughs, {} high severity",
                values.length, result.getPeakCount(), result.getTroughCount(), result.getHighSeverityCount());
        return result;
    }

    /**
     * Month profile of a synthetic history, with its most recent points and a readable summary.
     */
    public SeasonalAnalysisPreview seasonalAnalysisPreview(int days) {
        requirePositiveDays(days);

        List<DataPoint> history = seriesGenerator.generate(days);
        SeasonalAnalysis analysis = analyzeSeasonalPatterns(history);

        double[] factors = analysis.getSeasonalFactors();
        double maxFactor = Arrays.stream(factors).max().orElse(0);
        double minFactor = Arrays.stream(factors).min().orElse(0);

        SeasonalAnalysisPreview.Summary summary = new SeasonalAnalysisPreview.Summary(
                monthName(analysis.getPeakMonth()),
                monthName(analysis.getLowMonth()),
                Math.round(analysis.getOverallAverage()),
                Math.round((maxFactor - minFactor) * 100) + "%");

        List<DataPoint> recent = history.subList(Math.max(0, history.size() - previewPoints), history.size());
        return new SeasonalAnalysisPreview(analysis, new ArrayList<>(recent), summary);
    }

    // ==================== HELPER METHODS ====================

    private TrendDirection classifyTrend(double slope) {
        if (slope > TREND_SLOPE_THRESHOLD) {
            return TrendDirection.INCREASING;
        } else if (slope < -TREND_SLOPE_THRESHOLD) {
            return TrendDirection.DECREASING;
        } else {
            return TrendDirection.STABLE;
        }
    }

    private double rSquared(double[] actual, List<TimeSeriesPoint> fitted) {
        double mean = Arrays.stream(actual).average().orElse(0);

        // both sums share one scale, so their ratio is unchanged and the squares stay finite
        double scale = 0;
        for (int i = 0; i < actual.length; i++) {
            scale = Math.max(scale, Math.abs(actual[i] - fitted.get(i).getPredicted()));
            scale = Math.max(scale, Math.abs(actual[i] - mean));
        }
        if (scale == 0) {
            return 1;
        }

        double ssRes = 0;
        double ssTot = 0;
        for (int i = 0; i < actual.length; i++) {
            double residual = (actual[i] - fitted.get(i).getPredicted()) / scale;
            double deviation = (actual[i] - mean) / scale;
            ssRes += residual * residual;
            ssTot += deviation * deviation;
        }

        if (ssTot == 0) {
            return ssRes == 0 ? 1 : 0;
        }
        return 1 - ssRes / ssTot;
    }

    private void validatePoints(List<DataPoint> points) {
        if (points == null) {
            throw new InvalidInputException("Data must be provided");
        }
        for (int i = 0; i < points.size(); i++) {
            DataPoint point = points.get(i);
            if (point == null || point.getDate() == null) {
                throw new InvalidInputException("Record " + i + " is missing a date");
            }
            if (Double.isNaN(point.getValue()) || Double.isInfinite(point.getValue())) {
                throw new InvalidInputException("Record " + i + " has a non-finite value");
            }
            if (Math.abs(point.getValue()) > DataPoint.MAX_ABS_VALUE) {
                throw new InvalidInputException("Record " + i + " has a value outside the supported range");
            }
        }
    }

    private void rejectDuplicateDates(List<DataPoint> sorted) {
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).getDate().equals(sorted.get(i - 1).getDate())) {
                throw new InvalidInputException("Duplicate date in series: " + sorted.get(i).getDate());
            }
        }
    }

    private void requirePositiveDays(int days) {
        if (days < 1) {
            throw new InvalidInputException("Days must be at least 1: " + days);
        }
    }

    private String monthName(int monthIndex) {
        return Month.of(monthIndex + 1).getDisplayName(TextStyle.FULL, Locale.US);
    }
}
