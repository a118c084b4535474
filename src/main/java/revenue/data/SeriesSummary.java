package revenue.data;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary statistics of a revenue series, for display next to a forecast.
 */
public final class SeriesSummary {

    private final LocalDate startDate;
    private final LocalDate endDate;
    private final int totalRecords;
    private final double totalRevenue;
    private final double averageDailyRevenue;
    private final double medianDailyRevenue;
    private final double maxDailyRevenue;
    private final double minDailyRevenue;
    private final double stdDailyRevenue;
    private final int zeroRevenueDays;
    private final int positiveRevenueDays;

    private SeriesSummary(TimeSeries series, DescriptiveStatistics stats, int zeroDays) {
        this.startDate = series.getFirstDate();
        this.endDate = series.getLastDate();
        this.totalRecords = series.size();
        this.totalRevenue = stats.getSum();
        this.averageDailyRevenue = stats.getMean();
        this.medianDailyRevenue = stats.getPercentile(50);
        this.maxDailyRevenue = stats.getMax();
        this.minDailyRevenue = stats.getMin();
        this.stdDailyRevenue = stats.getStandardDeviation();
        this.zeroRevenueDays = zeroDays;
        this.positiveRevenueDays = series.size() - zeroDays;
    }

    public static SeriesSummary of(TimeSeries series) {
        DescriptiveStatistics stats = new DescriptiveStatistics(series.values());
        int zeroDays = 0;
        for (double v : series.values()) {
            if (v <= SeriesPreparer.POSITIVE_OFFSET) zeroDays++;
        }
        return new SeriesSummary(series, stats, zeroDays);
    }

    public LocalDate getStartDate() { return startDate; }
    public LocalDate getEndDate() { return endDate; }
    public int getTotalRecords() { return totalRecords; }
    public double getTotalRevenue() { return totalRevenue; }
    public double getAverageDailyRevenue() { return averageDailyRevenue; }
    public double getMedianDailyRevenue() { return medianDailyRevenue; }
    public double getMaxDailyRevenue() { return maxDailyRevenue; }
    public double getMinDailyRevenue() { return minDailyRevenue; }
    public double getStdDailyRevenue() { return stdDailyRevenue; }
    public int getZeroRevenueDays() { return zeroRevenueDays; }
    public int getPositiveRevenueDays() { return positiveRevenueDays; }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("start", startDate.toString());
        out.put("end", endDate.toString());
        out.put("total_records", totalRecords);
        out.put("total_revenue", totalRevenue);
        out.put("average_daily_revenue", averageDailyRevenue);
        out.put("median_daily_revenue", medianDailyRevenue);
        out.put("max_daily_revenue", maxDailyRevenue);
        out.put("min_daily_revenue", minDailyRevenue);
        out.put("std_daily_revenue", stdDailyRevenue);
        out.put("zero_revenue_days", zeroRevenueDays);
        out.put("positive_revenue_days", positiveRevenueDays);
        return out;
    }
}
