package revenue;

import revenue.data.Observation;
import revenue.data.RevenueSeriesReader;
import revenue.data.SeriesSummary;
import revenue.exception.ForecastingException;
import revenue.ml.BacktestMetrics;
import revenue.ml.BacktestResult;
import revenue.ml.ForecastPoint;
import revenue.ml.ForecastReport;
import revenue.ml.ModelDiagnostics;
import revenue.ml.RevenueForecaster;
import revenue.ml.StationarityResult;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;

/**
 * Demo: forecast daily revenue with SARIMA and backtest the model.
 * Usage: Main [revenue.csv [forecastDays [backtestDays]]]; without a file a synthetic year is used.
 */
public class Main {

    public static void main(String[] args) throws IOException {
        ForecastSettings settings = ForecastSettings.load();
        List<Observation> rows;
        if (args.length > 0 && args[0] != null && !args[0].trim().isEmpty()) {
            rows = RevenueSeriesReader.fromCsv(Paths.get(args[0].trim()));
        } else {
            rows = ForecastApi.sampleObservations();
        }
        int forecastDays = args.length > 1 ? Integer.parseInt(args[1].trim()) : 30;
        int backtestDays = args.length > 2 ? Integer.parseInt(args[2].trim()) : settings.getDefaultBacktestDays();

        ForecastReport report;
        try {
            report = new RevenueForecaster(settings).run(rows, forecastDays, backtestDays,
                    stage -> System.out.println("... " + stage));
        } catch (ForecastingException e) {
            System.err.println(e.getErrorCode() + ": " + e.getMessage());
            System.exit(1);
            return;
        }

        SeriesSummary summary = report.getSummary();
        System.out.println();
        System.out.println("=== Data ===");
        System.out.printf("%s to %s, %d days, total %.2f, mean %.2f/day%n", summary.getStartDate(),
                summary.getEndDate(), summary.getTotalRecords(), summary.getTotalRevenue(), summary.getAverageDailyRevenue());
        System.out.printf("Validation: %d/%d checks passed%n", report.getValidation().getPassedCount(),
                report.getValidation().getChecks().size());

        StationarityResult st = report.getStationarity();
        System.out.printf("ADF %.3f (5%%: %.3f), KPSS %.3f (5%%: %.3f) -> %s%n", st.getAdfStatistic(),
                st.getAdfCriticalValue(), st.getKpssStatistic(), st.getKpssCriticalValue(),
                st.isStationary() ? "stationary" : "not stationary");
        System.out.println();

        ModelDiagnostics diag = report.getDiagnostics();
        System.out.println("=== SARIMA" + diag.getOrder() + diag.getSeasonalOrder() + " ===");
        System.out.printf("AIC = %.2f, BIC = %.2f, log-likelihood = %.2f%n", diag.getAic(), diag.getBic(), diag.getLogLikelihood());
        System.out.printf("Residuals: mean %.4f, std %.4f, Ljung-Box p = %.4f%n", diag.getResidualMean(),
                diag.getResidualStd(), diag.getLjungBoxPValue());
        System.out.println("Parameter importance: " + report.getParameterImportance());
        System.out.println();

        System.out.println("=== Forecast (" + report.getForecast().size() + " days) ===");
        for (ForecastPoint point : report.getForecast().getPoints()) {
            System.out.printf("%s  %10.2f  [%10.2f, %10.2f]%n", point.getDate(), point.getMean(),
                    point.getLowerBound(), point.getUpperBound());
        }

        if (report.getBacktest() != null) {
            BacktestResult bt = report.getBacktest();
            BacktestMetrics m = bt.getMetrics();
            System.out.println();
            System.out.println("=== Backtest " + bt.getTestPeriod() + " ===");
            System.out.printf("MAE %.2f, RMSE %.2f, MAPE %.2f%%%n", m.getMae(), m.getRmse(), m.getMape());
        } else if (report.getBacktestFailure() != null) {
            System.out.println();
            System.out.println("Backtest not run: " + report.getBacktestFailure().getMessage());
        }
    }
}
