package com.flagship.revenue_ledger.observability;

import com.flagship.revenue_ledger.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OutboxHealthIndicatorTest {

    private OutboxService outboxService;
    private OutboxHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        outboxService = mock(OutboxService.class);
        indicator = new OutboxHealthIndicator(outboxService);
        ReflectionTestUtils.setField(indicator, "maxRetries", 5);
        ReflectionTestUtils.setField(indicator, "backlogWarningThreshold", 100L);
    }

    @Test
    void up_WhenBacklogSmall() {
        when(outboxService.countUnpublished()).thenReturn(3L);
        when(outboxService.countDeadLettered(5)).thenReturn(0L);

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(3L, health.getDetails().get("backlog"));
    }

    @Test
    void unknown_WhenBacklogPastThreshold() {
        when(outboxService.countUnpublished()).thenReturn(101L);
        when(outboxService.countDeadLettered(5)).thenReturn(0L);

        assertEquals(Status.UNKNOWN, indicator.health().getStatus());
    }

    @Test
    void down_WhenAnyEventDeadLettered() {
        when(outboxService.countUnpublished()).thenReturn(1L);
        when(outboxService.countDeadLettered(5)).thenReturn(1L);

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(1L, health.getDetails().get("deadLetters"));
    }
}
