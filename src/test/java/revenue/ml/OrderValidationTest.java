package revenue.ml;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OrderValidationTest {

    @Test
    void acceptsIntegerAndWholeNumberLists() {
        assertThat(OrderValidation.isValid(List.of(1, 1, 1), List.of(1, 1, 1, 7))).isTrue();
        // JSON numbers arrive as doubles
        assertThat(OrderValidation.toOrder(List.of(2.0, 1.0, 0.0))).isEqualTo(ModelOrder.of(2, 1, 0));
        assertThat(OrderValidation.toSeasonalOrder(List.of(0.0, 0.0, 0.0, 0.0))).isEqualTo(SeasonalOrder.none());
    }

    @Test
    void rejectsMalformedLists() {
        assertThat(OrderValidation.toOrder(List.of(1, 1))).isNull();
        assertThat(OrderValidation.toOrder(List.of(1.5, 1, 1))).isNull();
        assertThat(OrderValidation.toOrder(List.of("1", 1, 1))).isNull();
        assertThat(OrderValidation.toOrder(Arrays.asList(1, null, 1))).isNull();
        assertThat(OrderValidation.toOrder(null)).isNull();
        assertThat(OrderValidation.isValid(List.of(1, 1, 1), List.of(1, 1, 1))).isFalse();
    }

    @Test
    void rejectsOutOfBoundOrders() {
        assertThat(OrderValidation.toOrder(List.of(6, 0, 0))).isNull();
        assertThat(OrderValidation.toOrder(List.of(0, 3, 0))).isNull();
        assertThat(OrderValidation.toOrder(List.of(-1, 0, 0))).isNull();
        assertThat(OrderValidation.toSeasonalOrder(List.of(1, 0, 0, 1))).isNull();
    }

    @Test
    void ordersPrintAsTuples() {
        assertThat(ModelOrder.of(1, 2, 3).toList()).containsExactly(1, 2, 3);
        assertThat(SeasonalOrder.of(1, 1, 1, 7).toList()).containsExactly(1, 1, 1, 7);
        assertThat(ModelOrder.of(1, 2, 3)).hasToString("(1,2,3)");
    }
}
