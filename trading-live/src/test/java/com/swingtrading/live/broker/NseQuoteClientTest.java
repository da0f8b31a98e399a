package com.swingtrading.live.broker;

import com.swingtrading.error.ExternalServiceException;
import com.swingtrading.model.PriceSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

class NseQuoteClientTest {

    private static final Instant NOW = Instant.parse("2024-03-06T04:30:00Z");

    private static final String PAYLOAD = """
        {"name":"NIFTY 50","data":[
          {"symbol":"NIFTY 50","lastPrice":22474.05,"dayHigh":22497.2,"dayLow":22224.35},
          {"symbol":"RELIANCE","lastPrice":"2,986.40","dayHigh":"3,001.10","dayLow":"2,960.00"},
          {"symbol":"TCS","lastPrice":4012.5,"dayHigh":null,"dayLow":"-"},
          {"symbol":"INFY","lastPrice":"-"}
        ]}
        """;

    @TempDir
    Path historyDir;

    private NseQuoteClient client() {
        return new NseQuoteClient(historyDir, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Parses numbers given as text with thousands separators")
    void parsesTextNumbers() {
        Quote quote = client().parseQuote(PAYLOAD, "RELIANCE", NOW);

        assertEquals(2_986.40, quote.last(), 1e-9);
        assertEquals(3_001.10, quote.dayHigh(), 1e-9);
        assertEquals(2_960.00, quote.dayLow(), 1e-9);
        assertEquals(NOW, quote.timestamp());
    }

    @Test
    @DisplayName("Missing high and low fall back to the last price")
    void missingRangeFallsBack() {
        Quote quote = client().parseQuote(PAYLOAD, "TCS", NOW);

        assertNull(quote.dayHigh());
        assertNull(quote.dayLow());
        assertEquals(4_012.5, quote.highOrLast(), 1e-9);
        assertEquals(4_012.5, quote.lowOrLast(), 1e-9);
    }

    @Test
    @DisplayName("No last price, unknown symbol and malformed payloads are service failures")
    void failures() {
        NseQuoteClient client = client();

        assertThatThrownBy(() -> client.parseQuote(PAYLOAD, "INFY", NOW))
            .isInstanceOf(ExternalServiceException.class).hasMessageContaining("no last price");
        assertThatThrownBy(() -> client.parseQuote(PAYLOAD, "WIPRO", NOW))
            .isInstanceOf(ExternalServiceException.class).hasMessageContaining("not in index payload");
        assertThatThrownBy(() -> client.parseQuote("{\"status\":\"ok\"}", "TCS", NOW))
            .isInstanceOf(ExternalServiceException.class).hasMessageContaining("without data array");
        assertThatThrownBy(() -> client.parseQuote("<html>", "TCS", NOW))
            .isInstanceOf(ExternalServiceException.class);
    }

    @Test
    @DisplayName("Daily history comes from the symbol's CSV, trimmed to the most recent bars")
    void historyFromCsv() throws IOException {
        Files.writeString(historyDir.resolve("TCS.csv"), """
            Date,Open,High,Low,Close,Volume
            2024-03-01,100,101,99,100.5,1000
            2024-03-04,100.5,102,100,101.5,1100
            2024-03-05,101.5,103,101,102.5,1200
            """);

        PriceSeries series = client().fetchDailyHistory("TCS", 2);

        assertEquals(2, series.size());
        assertEquals(LocalDate.of(2024, 3, 4), series.get(0).date());
        assertEquals(102.5, series.last().close(), 1e-9);
    }

    @Test
    @DisplayName("Missing history file is a service failure")
    void missingHistory() {
        assertThrows(ExternalServiceException.class, () -> client().fetchDailyHistory("WIPRO", 10));
    }
}
