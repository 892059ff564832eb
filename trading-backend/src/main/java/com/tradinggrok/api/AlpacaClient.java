package com.tradinggrok.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradinggrok.api.model.AlpacaAccount;
import com.tradinggrok.api.model.AlpacaCalendarDay;
import com.tradinggrok.api.model.AlpacaOrder;
import com.tradinggrok.api.model.AlpacaPosition;
import com.tradinggrok.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * HTTP client for the Alpaca trading and market data REST APIs.
 * Non-2xx answers surface as {@link AlpacaApiException}; transport failures as {@link IOException}.
 */
public final class AlpacaClient {
    private static final Logger logger = LoggerFactory.getLogger(AlpacaClient.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String dataUrl;
    private final String apiKey;
    private final String apiSecret;

    public AlpacaClient(Config config) {
        this(config.baseUrl(), config.dataUrl(), config.apiKey(), config.apiSecret());
    }

    AlpacaClient(String baseUrl, String dataUrl, String apiKey, String apiSecret) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.dataUrl = stripTrailingSlash(dataUrl);
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(REQUEST_TIMEOUT)
                .build();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        logger.info("AlpacaClient initialized for {}", this.baseUrl);
    }

    public AlpacaAccount getAccount() throws IOException, InterruptedException {
        logger.debug("Fetching account information");
        var response = sendRequest(baseUrl + "/v2/account", "GET");
        return objectMapper.readValue(response, AlpacaAccount.class);
    }

    public List<AlpacaPosition> getPositions() throws IOException, InterruptedException {
        logger.debug("Fetching all open positions");
        var response = sendRequest(baseUrl + "/v2/positions", "GET");
        return objectMapper.readValue(response, new TypeReference<List<AlpacaPosition>>() {});
    }

    public List<AlpacaOrder> getOpenOrders() throws IOException, InterruptedException {
        logger.debug("Fetching open orders");
        var response = sendRequest(baseUrl + "/v2/orders?status=open&limit=500", "GET");
        return objectMapper.readValue(response, new TypeReference<List<AlpacaOrder>>() {});
    }

    /**
     * @return the order, or empty if the broker does not know the id
     */
    public Optional<AlpacaOrder> getOrder(String orderId) throws IOException, InterruptedException {
        try {
            var response = sendRequest(baseUrl + "/v2/orders/" + encode(orderId), "GET");
            return Optional.of(objectMapper.readValue(response, AlpacaOrder.class));
        } catch (AlpacaApiException e) {
            if (e.getStatusCode() == 404) {
                logger.debug("Order {} not found", orderId);
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * Place a day order for whole shares.
     *
     * @param limitPrice required for limit orders, ignored otherwise
     * @param clientOrderId idempotency key echoed back by the broker, may be null
     */
    public AlpacaOrder placeOrder(String symbol, long qty, String side, String type,
                                  BigDecimal limitPrice, String clientOrderId)
            throws IOException, InterruptedException {
        var order = objectMapper.createObjectNode()
            .put("symbol", symbol)
            .put("qty", Long.toString(qty))
            .put("side", side)
            .put("type", type)
            .put("time_in_force", "day");

        if ("limit".equals(type)) {
            order.put("limit_price", limitPrice.setScale(2, RoundingMode.HALF_UP).toPlainString());
        }
        if (clientOrderId != null) {
            order.put("client_order_id", clientOrderId);
        }

        var body = objectMapper.writeValueAsString(order);
        logger.info("Placing order: {}", body);
        var response = sendRequest(baseUrl + "/v2/orders", "POST", body);
        return objectMapper.readValue(response, AlpacaOrder.class);
    }

    /**
     * @return false if the broker says the order is no longer cancellable (422) or unknown (404)
     */
    public boolean cancelOrder(String orderId) throws IOException, InterruptedException {
        try {
            sendRequest(baseUrl + "/v2/orders/" + encode(orderId), "DELETE");
            logger.info("Cancel requested for order {}", orderId);
            return true;
        } catch (AlpacaApiException e) {
            if (e.getStatusCode() == 422 || e.getStatusCode() == 404) {
                logger.info("Order {} not cancellable: {}", orderId, e.getStatusCode());
                return false;
            }
            throw e;
        }
    }

    /**
     * Latest trade price from the IEX feed, empty if the data API has no trade for the symbol.
     */
    public Optional<BigDecimal> getLatestTradePrice(String symbol) throws IOException, InterruptedException {
        var url = dataUrl + "/v2/stocks/" + encode(symbol.toUpperCase(Locale.ROOT)) + "/trades/latest?feed=iex";
        String response;
        try {
            response = sendRequest(url, "GET");
        } catch (AlpacaApiException e) {
            if (e.getStatusCode() == 404) {
                return Optional.empty();
            }
            throw e;
        }
        JsonNode price = objectMapper.readTree(response).path("trade").path("p");
        if (!price.isNumber()) {
            logger.debug("No latest trade for {}", symbol);
            return Optional.empty();
        }
        return Optional.of(price.decimalValue());
    }

    /**
     * Regular market sessions between two dates inclusive. Holidays are absent; early closes carry their close time.
     */
    public List<AlpacaCalendarDay> getCalendar(LocalDate start, LocalDate end) throws IOException, InterruptedException {
        logger.debug("Fetching market calendar {} to {}", start, end);
        var response = sendRequest(baseUrl + "/v2/calendar?start=" + start + "&end=" + end, "GET");
        return objectMapper.readValue(response, new TypeReference<List<AlpacaCalendarDay>>() {});
    }

    private String sendRequest(String url, String method) throws IOException, InterruptedException {
        return sendRequest(url, method, null);
    }

    private String sendRequest(String url, String method, String body) throws IOException, InterruptedException {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("APCA-API-KEY-ID", apiKey)
                .header("APCA-API-SECRET-KEY", apiSecret)
                .header("Content-Type", "application/json")
                .timeout(REQUEST_TIMEOUT);

        var request = switch (method.toUpperCase(Locale.ROOT)) {
            case "GET" -> builder.GET().build();
            case "POST" -> builder.POST(HttpRequest.BodyPublishers.ofString(body != null ? body : "{}")).build();
            case "DELETE" -> builder.DELETE().build();
            default -> throw new IllegalArgumentException(String.format("Unsupported HTTP method: %s", method));
        };

        var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() >= 200 && response.statusCode() < 300) {
            return response.body();
        }
        var error = new AlpacaApiException(response.statusCode(), response.body());
        if (response.statusCode() == 404) {
            logger.debug(error.getMessage());
        } else if (error.isRateLimited()) {
            logger.warn("API Rate Limit (429) on {} {}", method, url);
        } else {
            logger.error(error.getMessage());
        }
        throw error;
    }

    private static String encode(String pathSegment) {
        return URLEncoder.encode(pathSegment, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
