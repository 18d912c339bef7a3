package com.rebalance.backend.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OrderStatusTest {

    @Test
    void terminalStatusesNeverMoveForward() {
        for (OrderStatus terminal : new OrderStatus[]{OrderStatus.FILLED, OrderStatus.CANCELED, OrderStatus.REJECTED,
                OrderStatus.SKIPPED}) {
            for (OrderStatus target : OrderStatus.values()) {
                assertThat(terminal.canTransitionTo(target)).isEqualTo(terminal == target);
            }
        }
    }

    @Test
    void partialCanOnlyFillOrCancel() {
        assertThat(OrderStatus.PARTIAL.canTransitionTo(OrderStatus.FILLED)).isTrue();
        assertThat(OrderStatus.PARTIAL.canTransitionTo(OrderStatus.CANCELED)).isTrue();
        assertThat(OrderStatus.PARTIAL.canTransitionTo(OrderStatus.SUBMITTED)).isFalse();
        assertThat(OrderStatus.PARTIAL.canTransitionTo(OrderStatus.REJECTED)).isFalse();
    }

    @Test
    void reopenOnlyFromLowConfidenceStatuses() {
        assertThat(OrderStatus.CANCELED.canReopenTo(OrderStatus.FILLED)).isTrue();
        assertThat(OrderStatus.SKIPPED.canReopenTo(OrderStatus.SUBMITTED)).isTrue();
        assertThat(OrderStatus.REJECTED.canReopenTo(OrderStatus.FILLED)).isFalse();
        assertThat(OrderStatus.CANCELED.canReopenTo(OrderStatus.NEW)).isFalse();
    }

    @Test
    void parsesBrokerSpellings() {
        assertThat(OrderStatus.fromString("Cancelled")).isEqualTo(OrderStatus.CANCELED);
        assertThat(OrderStatus.fromString("PartiallyFilled")).isEqualTo(OrderStatus.PARTIAL);
        assertThat(OrderStatus.fromString("PreSubmitted")).isEqualTo(OrderStatus.SUBMITTED);
        assertThat(OrderStatus.fromString("PendingSubmit")).isNull();
    }
}
