package com.swingtrading.persistence;

import com.swingtrading.model.Position;
import com.swingtrading.model.TradeEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.swingtrading.Fixtures.START;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TradeEventPublisher Tests")
@ExtendWith(MockitoExtension.class)
class TradeEventPublisherTest {

    @Mock
    private TradeEventSink broken;

    @Mock
    private TradeEventSink healthy;

    private static TradeEvent event() {
        Position position = Position.open("TCS", START, 100.0, 10, 0.001, 0.03, 0.12, 0.5, Map.of());
        return TradeEvent.entry(position, "MA_CROSSOVER", TradeEvent.barTimestamp(START));
    }

    @Test
    @DisplayName("Every sink receives the event even when an earlier one fails")
    void isolatesFailures() {
        TradeEvent event = event();
        doThrow(new IllegalStateException("database is locked")).when(broken).record(event);
        var publisher = new TradeEventPublisher(List.of(broken, healthy));

        publisher.publish(event);
        publisher.publish(event);

        verify(healthy, times(2)).record(event);
        assertEquals(2, publisher.getFailureCount());
        assertEquals(2, publisher.getPublishedCount());
    }

    @Test
    @DisplayName("Publishing without sinks only logs")
    void noSinks() {
        var publisher = TradeEventPublisher.none();

        publisher.publish(event());

        assertEquals(1, publisher.getPublishedCount());
        assertEquals(0, publisher.getFailureCount());
    }
}
