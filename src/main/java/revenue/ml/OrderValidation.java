package revenue.ml;

import java.util.List;

/**
 * Checks configured orders before use. Configuration hands orders over as loosely typed lists
 * (JSON arrays, form fields); anything that is not exactly 3 and 4 integers within bounds is invalid.
 */
public final class OrderValidation {

    private OrderValidation() {}

    public static boolean isValid(List<?> order, List<?> seasonalOrder) {
        return toOrder(order) != null && toSeasonalOrder(seasonalOrder) != null;
    }

    /** The order, or {@code null} if the list is not a valid (p,d,q). */
    public static ModelOrder toOrder(List<?> order) {
        int[] v = toInts(order, 3);
        if (v == null) return null;
        try {
            return ModelOrder.of(v[0], v[1], v[2]);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** The seasonal order, or {@code null} if the list is not a valid (P,D,Q,s). */
    public static SeasonalOrder toSeasonalOrder(List<?> seasonalOrder) {
        int[] v = toInts(seasonalOrder, 4);
        if (v == null) return null;
        try {
            return SeasonalOrder.of(v[0], v[1], v[2], v[3]);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static int[] toInts(List<?> values, int arity) {
        if (values == null || values.size() != arity) return null;
        int[] out = new int[arity];
        for (int i = 0; i < arity; i++) {
            Object o = values.get(i);
            if (o instanceof Integer || o instanceof Long || o instanceof Short) {
                out[i] = ((Number) o).intValue();
            } else if (o instanceof Number) {
                // JSON numbers arrive as doubles; accept only whole values
                double d = ((Number) o).doubleValue();
                if (d != Math.rint(d) || Double.isInfinite(d)) return null;
                out[i] = (int) d;
            } else {
                return null;
            }
        }
        return out;
    }
}
