package com.marketfeed.marketdata.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketfeed.common.exception.FetchException;
import com.marketfeed.common.model.Candle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GmxCandleClientTest {

    private final GmxCandleClient client =
        new GmxCandleClient(WebClient.create("http://localhost:1"), new ObjectMapper());

    @Test
    @DisplayName("rows [ts, o, h, l, c] become candles; short rows skipped")
    void parsesRows() {
        String json = "{\"period\": \"15m\", \"candles\": ["
            + "[1700000900, 101.0, 103.0, 100.5, 102.0],"
            + "[1700000000, 100.0, 101.5, 99.0, 101.0],"
            + "[1699999100, 99.0]]}";

        List<Candle> candles = client.parseCandles("candles:ETH:15m", json);

        assertEquals(2, candles.size());
        assertEquals(new Candle(1_700_000_900L, 101.0, 103.0, 100.5, 102.0), candles.get(0));
        assertEquals(101.0, candles.get(1).close());
    }

    @Test
    @DisplayName("missing candles array → FetchException")
    void rejectsMissingCandles() {
        assertThrows(FetchException.class, () -> client.parseCandles("candles:ETH:15m", "{\"error\": 1}"));
        assertThrows(FetchException.class, () -> client.parseCandles("candles:ETH:15m", "<html>"));
    }
}
