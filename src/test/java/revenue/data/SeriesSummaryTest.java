package revenue.data;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class SeriesSummaryTest {

    @Test
    void summarizesDailyRevenue() {
        TimeSeries series = TimeSeries.daily(LocalDate.of(2024, 5, 1), new double[]{0, 10, 20, 30, 0});

        SeriesSummary summary = SeriesSummary.of(series);

        assertThat(summary.getStartDate()).isEqualTo(LocalDate.of(2024, 5, 1));
        assertThat(summary.getEndDate()).isEqualTo(LocalDate.of(2024, 5, 5));
        assertThat(summary.getTotalRecords()).isEqualTo(5);
        assertThat(summary.getTotalRevenue()).isEqualTo(60.0);
        assertThat(summary.getAverageDailyRevenue()).isEqualTo(12.0);
        assertThat(summary.getMedianDailyRevenue()).isEqualTo(10.0);
        assertThat(summary.getMaxDailyRevenue()).isEqualTo(30.0);
        assertThat(summary.getZeroRevenueDays()).isEqualTo(2);
        assertThat(summary.getPositiveRevenueDays()).isEqualTo(3);
        assertThat(summary.toMap()).containsEntry("total_records", 5);
    }
}
