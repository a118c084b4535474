package revenue.data;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import revenue.exception.DataException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RevenueSeriesReaderTest {

    @Test
    void readsCsvWithAnyColumnOrder(@TempDir Path dir) throws IOException {
        Path csv = dir.resolve("revenue.csv");
        Files.write(csv, List.of(
            "# exported report",
            "impressions,Revenue,date",
            "1200,10.5,2024-01-01",
            "900,,2024-01-02",
            "",
            "1500,12.25,2024-01-03"), StandardCharsets.UTF_8);

        List<Observation> rows = RevenueSeriesReader.fromCsv(csv);

        assertThat(rows).hasSize(3);
        assertThat(rows.get(0)).isEqualTo(Observation.of(LocalDate.of(2024, 1, 1), 10.5));
        assertThat(rows.get(1).getRevenue()).isNull();
        assertThat(rows.get(2).getRevenue()).isEqualTo(12.25);
    }

    @Test
    void csvWithoutRevenueColumnIsRejected() {
        assertThatThrownBy(() -> RevenueSeriesReader.fromCsvLines(List.of("date,earnings", "2024-01-01,3")))
            .isInstanceOf(DataException.class)
            .hasMessageContaining("revenue");
    }

    @Test
    void badDateNamesTheLine() {
        assertThatThrownBy(() -> RevenueSeriesReader.fromCsvLines(List.of("date,revenue", "01/02/2024,3")))
            .isInstanceOf(DataException.class)
            .hasMessageContaining("01/02/2024");
    }

    @Test
    void readsJsonRows() {
        List<Observation> rows = RevenueSeriesReader.fromJson(
            "[{\"date\": \"2024-02-28\", \"revenue\": 7}, {\"date\": \"2024-02-29\", \"revenue\": null}]");

        assertThat(rows).containsExactly(
            Observation.of(LocalDate.of(2024, 2, 28), 7),
            new Observation(LocalDate.of(2024, 2, 29), null));
    }

    @Test
    void jsonWithoutRevenueFieldIsRejected() {
        assertThatThrownBy(() -> RevenueSeriesReader.fromJson("[{\"date\": \"2024-02-28\", \"clicks\": 7}]"))
            .isInstanceOf(DataException.class)
            .hasMessageContaining("revenue");
        assertThatThrownBy(() -> RevenueSeriesReader.fromJson("{\"date\": \"2024-02-28\"}"))
            .isInstanceOf(DataException.class);
    }

    @Test
    void jsonRowsWithStructuredValuesAreDataErrors() {
        assertThatThrownBy(() -> RevenueSeriesReader.fromJson("[{\"date\": {\"y\": 2024}, \"revenue\": 7}]"))
            .isInstanceOf(DataException.class)
            .hasMessageContaining("date");
        assertThatThrownBy(() -> RevenueSeriesReader.fromJson("[{\"date\": [\"2024-02-28\", \"x\"], \"revenue\": 7}]"))
            .isInstanceOf(DataException.class)
            .hasMessageContaining("date");
        assertThatThrownBy(() -> RevenueSeriesReader.fromJson("[{\"date\": \"2024-02-28\", \"revenue\": [1, 2]}]"))
            .isInstanceOf(DataException.class)
            .hasMessageContaining("revenue");
    }
}
