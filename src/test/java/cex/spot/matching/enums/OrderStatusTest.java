package cex.spot.matching.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Order Status Tests")
class OrderStatusTest {

    @Test
    @DisplayName("Fill state follows filled amount vs amount")
    void testFromFill() {
        BigDecimal amount = new BigDecimal("3");

        assertThat(OrderStatus.fromFill(BigDecimal.ZERO, amount)).isEqualTo(OrderStatus.PENDING);
        assertThat(OrderStatus.fromFill(new BigDecimal("0.000001"), amount)).isEqualTo(OrderStatus.PARTIALLY_FILLED);
        assertThat(OrderStatus.fromFill(new BigDecimal("2.999999"), amount)).isEqualTo(OrderStatus.PARTIALLY_FILLED);
        assertThat(OrderStatus.fromFill(new BigDecimal("3.000"), amount)).isEqualTo(OrderStatus.FILLED);
    }

    @Test
    @DisplayName("Only FILLED and CANCELLED are terminal")
    void testTerminalStates() {
        assertThat(OrderStatus.PENDING.isTerminal()).isFalse();
        assertThat(OrderStatus.PARTIALLY_FILLED.isTerminal()).isFalse();
        assertThat(OrderStatus.FILLED.isTerminal()).isTrue();
        assertThat(OrderStatus.CANCELLED.isTerminal()).isTrue();
    }

    @Test
    @DisplayName("Opposite side")
    void testOppositeSide() {
        assertThat(OrderSide.BUY.opposite()).isEqualTo(OrderSide.SELL);
        assertThat(OrderSide.SELL.opposite()).isEqualTo(OrderSide.BUY);
    }
}
