package revenue.data;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import revenue.exception.DataException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads raw revenue rows from CSV or JSON.
 * <p>
 * CSV: a header naming a {@code date} and a {@code revenue} column (any order, separated by
 * comma, semicolon or tab), one row per day. An empty revenue cell is read as missing.
 * <br>
 * JSON: an array of objects {@code {"date": "2024-09-01", "revenue": 12.5}}.
 */
public final class RevenueSeriesReader {

    public static final String DATE_FIELD = "date";
    public static final String REVENUE_FIELD = "revenue";

    private RevenueSeriesReader() {}

    public static List<Observation> fromCsv(Path path) throws IOException {
        return fromCsvLines(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    public static List<Observation> fromCsvLines(List<String> lines) {
        int dateCol = -1;
        int revenueCol = -1;
        List<Observation> rows = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split("[,;\t]", -1);
            if (dateCol < 0) {
                for (int j = 0; j < parts.length; j++) {
                    String name = parts[j].trim().toLowerCase(Locale.ROOT);
                    if (name.equals(DATE_FIELD)) dateCol = j;
                    else if (name.equals(REVENUE_FIELD)) revenueCol = j;
                }
                if (dateCol < 0) throw new DataException("CSV header must contain a 'date' column");
                if (revenueCol < 0) throw new DataException("Data must contain a 'revenue' column");
                continue;
            }
            if (parts.length <= Math.max(dateCol, revenueCol)) {
                throw new DataException("Line " + (i + 1) + " has too few columns");
            }
            rows.add(new Observation(parseDate(parts[dateCol].trim(), i + 1), parseRevenue(parts[revenueCol].trim(), i + 1)));
        }
        if (dateCol < 0) throw new DataException("Empty file");
        return rows;
    }

    public static List<Observation> fromJson(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new DataException("Invalid JSON", e);
        }
        if (root == null || !root.isJsonArray()) throw new DataException("Expected a JSON array of {date, revenue} rows");
        return fromJson(root.getAsJsonArray());
    }

    public static List<Observation> fromJson(JsonArray array) {
        List<Observation> rows = new ArrayList<>(array.size());
        boolean anyRevenue = false;
        for (int i = 0; i < array.size(); i++) {
            JsonElement el = array.get(i);
            if (!el.isJsonObject()) throw new DataException("Row " + i + " is not an object");
            JsonObject obj = el.getAsJsonObject();
            if (!obj.has(DATE_FIELD) || obj.get(DATE_FIELD).isJsonNull()) throw new DataException("Row " + i + " has no date");
            String dateText;
            try {
                dateText = obj.get(DATE_FIELD).getAsString();
            } catch (UnsupportedOperationException | IllegalStateException e) {
                // objects and arrays other than a single primitive
                throw new DataException("Row " + i + " has a date that is not a string", e);
            }
            LocalDate date = parseDate(dateText, i);
            Double revenue = null;
            if (obj.has(REVENUE_FIELD)) {
                anyRevenue = true;
                JsonElement r = obj.get(REVENUE_FIELD);
                if (!r.isJsonNull()) {
                    try {
                        revenue = r.getAsDouble();
                    } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
                        throw new DataException("Row " + i + " has a non-numeric revenue", e);
                    }
                }
            }
            rows.add(new Observation(date, revenue));
        }
        if (!rows.isEmpty() && !anyRevenue) throw new DataException("Data must contain a 'revenue' field");
        return rows;
    }

    private static LocalDate parseDate(String text, int line) {
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new DataException("Invalid date '" + text + "' at " + line, e);
        }
    }

    private static Double parseRevenue(String text, int line) {
        if (text.isEmpty()) return null;
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new DataException("Invalid revenue '" + text + "' at line " + line, e);
        }
    }
}
