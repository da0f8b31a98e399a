package com.swingtrading.live.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swingtrading.data.HistoricalDataLoader;
import com.swingtrading.error.ExternalServiceException;
import com.swingtrading.model.PriceSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.CookieManager;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Quotes from the NSE India public index endpoint; daily history from the
 * local CSV store the data download job maintains.
 * <p>
 * NSE answers only with session cookies, so the client first visits the
 * market page and retries that handshake after a 401.
 */
public final class NseQuoteClient implements MarketDataProvider {
    private static final Logger logger = LoggerFactory.getLogger(NseQuoteClient.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final String SERVICE = "nse";

    private static final String BASE_URL = "https://www.nseindia.com";
    private static final String COOKIE_PAGE = BASE_URL + "/market-data/live-equity-market";
    private static final String INDEX_URL = BASE_URL + "/api/equity-stockIndices?index=NIFTY%2050";
    private static final String USER_AGENT =
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/119.0.0.0 Safari/537.36";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HistoricalDataLoader historyLoader = new HistoricalDataLoader();
    private final Path historyDirectory;
    private final Clock clock;
    private volatile boolean cookiesObtained;

    public NseQuoteClient(Path historyDirectory, Clock clock) {
        this.historyDirectory = historyDirectory;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(REQUEST_TIMEOUT)
            .cookieHandler(new CookieManager())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        logger.info("NseQuoteClient initialized (history from {})", historyDirectory.toAbsolutePath());
    }

    @Override
    public Quote fetchQuote(String symbol) {
        if (!cookiesObtained) {
            obtainCookies();
        }
        HttpResponse<String> response = send(INDEX_URL);
        if (response.statusCode() == 401 || response.statusCode() == 403) {
            cookiesObtained = false;
            throw new ExternalServiceException(SERVICE, "session expired (" + response.statusCode() + ")");
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new ExternalServiceException(SERVICE, "quote request failed: " + response.statusCode());
        }
        return parseQuote(response.body(), symbol, clock.instant());
    }

    @Override
    public PriceSeries fetchDailyHistory(String symbol, int days) {
        Path file = historyDirectory.resolve(symbol + ".csv");
        if (!Files.exists(file)) {
            throw new ExternalServiceException(SERVICE, "no history file for " + symbol + " at " + file);
        }
        PriceSeries all = historyLoader.load(symbol, file);
        if (all.size() <= days) {
            return all;
        }
        return new PriceSeries(symbol, all.bars().subList(all.size() - days, all.size()));
    }

    /**
     * Extract one instrument from the index payload ({@code data[].symbol/lastPrice/dayHigh/dayLow}).
     */
    Quote parseQuote(String body, String symbol, Instant timestamp) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new ExternalServiceException(SERVICE, "unreadable quote payload", e);
        }
        JsonNode data = root.get("data");
        if (data == null || !data.isArray()) {
            throw new ExternalServiceException(SERVICE, "quote payload without data array");
        }
        for (JsonNode stock : data) {
            if (symbol.equals(stock.path("symbol").asText())) {
                Quote quote = new Quote(symbol, number(stock, "lastPrice"), number(stock, "dayHigh"),
                    number(stock, "dayLow"), timestamp);
                if (!quote.hasPrice()) {
                    throw new ExternalServiceException(SERVICE, "no last price for " + symbol);
                }
                logger.debug("{}: last {}", symbol, String.format("%.2f", quote.last()));
                return quote;
            }
        }
        throw new ExternalServiceException(SERVICE, "symbol " + symbol + " not in index payload");
    }

    private void obtainCookies() {
        HttpResponse<String> response = send(COOKIE_PAGE);
        if (response.statusCode() != 200) {
            throw new ExternalServiceException(SERVICE, "cookie handshake failed: " + response.statusCode());
        }
        cookiesObtained = true;
        logger.debug("NSE session cookies obtained");
    }

    private HttpResponse<String> send(String url) {
        var request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("User-Agent", USER_AGENT)
            .header("Accept", "*/*")
            .header("Referer", COOKIE_PAGE)
            .timeout(REQUEST_TIMEOUT)
            .GET()
            .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExternalServiceException(SERVICE, "request to " + url + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException(SERVICE, "interrupted while calling " + url, e);
        }
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        String text = value.asText().replace(",", "").trim();
        if (text.isEmpty() || text.equals("-")) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            logger.debug("Unparseable {} '{}'", field, text);
            return null;
        }
    }
}
