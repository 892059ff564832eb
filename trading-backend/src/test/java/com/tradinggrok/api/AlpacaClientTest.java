package com.tradinggrok.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradinggrok.api.model.AlpacaCalendarDay;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AlpacaClient Tests")
class AlpacaClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private AlpacaClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        String url = server.url("/").toString();
        client = new AlpacaClient(url, url, "key-id", "secret-key");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(int code, String body) {
        return new MockResponse().setResponseCode(code)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }

    @Test
    @DisplayName("Account request carries API key headers and parses decimals")
    void account() throws Exception {
        server.enqueue(json(200, "{\"status\":\"ACTIVE\",\"equity\":\"10000.50\",\"buying_power\":\"20001\","
            + "\"cash\":\"5000\",\"trading_blocked\":false,\"account_number\":\"PA123\"}"));

        var account = client.getAccount();

        assertThat(account.equity()).isEqualByComparingTo("10000.50");
        assertThat(account.buyingPower()).isEqualByComparingTo("20001");
        assertThat(account.tradingBlocked()).isFalse();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v2/account");
        assertThat(request.getHeader("APCA-API-KEY-ID")).isEqualTo("key-id");
        assertThat(request.getHeader("APCA-API-SECRET-KEY")).isEqualTo("secret-key");
    }

    @Test
    @DisplayName("Positions parse string quantities")
    void positions() throws Exception {
        server.enqueue(json(200, "[{\"symbol\":\"AAPL\",\"qty\":\"12\",\"side\":\"long\","
            + "\"avg_entry_price\":\"150.25\",\"current_price\":\"155.00\",\"market_value\":\"1860\"}]"));

        var positions = client.getPositions();

        assertThat(positions).hasSize(1);
        assertThat(positions.get(0).symbol()).isEqualTo("AAPL");
        assertThat(positions.get(0).quantity()).isEqualByComparingTo("12");
        assertThat(positions.get(0).avgEntryPrice()).isEqualByComparingTo("150.25");
    }

    @Nested
    @DisplayName("Orders")
    class Orders {

        @Test
        @DisplayName("Market order body uses whole shares and a day time-in-force")
        void placeMarketOrder() throws Exception {
            server.enqueue(json(200, "{\"id\":\"ord-1\",\"symbol\":\"AAPL\",\"side\":\"buy\",\"qty\":\"10\","
                + "\"filled_qty\":\"0\",\"status\":\"accepted\",\"submitted_at\":\"2024-03-18T14:00:00Z\"}"));

            var order = client.placeOrder("AAPL", 10, "buy", "market", null, "tg-entry-1");

            assertThat(order.id()).isEqualTo("ord-1");
            assertThat(order.submittedAt()).isEqualTo(Instant.parse("2024-03-18T14:00:00Z"));

            RecordedRequest request = server.takeRequest();
            assertThat(request.getMethod()).isEqualTo("POST");
            assertThat(request.getPath()).isEqualTo("/v2/orders");
            JsonNode body = mapper.readTree(request.getBody().readUtf8());
            assertThat(body.get("qty").asText()).isEqualTo("10");
            assertThat(body.get("side").asText()).isEqualTo("buy");
            assertThat(body.get("type").asText()).isEqualTo("market");
            assertThat(body.get("time_in_force").asText()).isEqualTo("day");
            assertThat(body.get("client_order_id").asText()).isEqualTo("tg-entry-1");
            assertThat(body.has("limit_price")).isFalse();
        }

        @Test
        @DisplayName("Limit price is sent with two decimals")
        void placeLimitOrder() throws Exception {
            server.enqueue(json(200, "{\"id\":\"ord-2\",\"status\":\"new\"}"));

            client.placeOrder("MSFT", 3, "sell", "limit", new BigDecimal("401.005"), null);

            JsonNode body = mapper.readTree(server.takeRequest().getBody().readUtf8());
            assertThat(body.get("limit_price").asText()).isEqualTo("401.01");
            assertThat(body.has("client_order_id")).isFalse();
        }

        @Test
        @DisplayName("Unknown order id is empty")
        void orderNotFound() throws Exception {
            server.enqueue(json(404, "{\"message\":\"order not found\"}"));

            assertThat(client.getOrder("missing")).isEmpty();
        }

        @Test
        @DisplayName("Filled order carries fill details")
        void filledOrder() throws Exception {
            server.enqueue(json(200, "{\"id\":\"ord-3\",\"symbol\":\"NVDA\",\"side\":\"buy\",\"qty\":\"5\","
                + "\"filled_qty\":\"5\",\"filled_avg_price\":\"880.10\",\"status\":\"filled\","
                + "\"filled_at\":\"2024-03-18T14:05:00.123456Z\"}"));

            var order = client.getOrder("ord-3").orElseThrow();

            assertThat(order.filledQuantity()).isEqualByComparingTo("5");
            assertThat(order.filledAvgPrice()).isEqualByComparingTo("880.10");
            assertThat(order.status()).isEqualTo("filled");
            assertThat(server.takeRequest().getPath()).isEqualTo("/v2/orders/ord-3");
        }

        @Test
        @DisplayName("Cancel returns false when the order is no longer cancellable")
        void cancelNotCancellable() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(204));
            server.enqueue(json(422, "{\"message\":\"order is already in filled state\"}"));

            assertThat(client.cancelOrder("ord-1")).isTrue();
            assertThat(client.cancelOrder("ord-2")).isFalse();
            assertThat(server.takeRequest().getMethod()).isEqualTo("DELETE");
        }

        @Test
        @DisplayName("Open orders query filters on status")
        void openOrders() throws Exception {
            server.enqueue(json(200, "[]"));

            assertThat(client.getOpenOrders()).isEmpty();
            assertThat(server.takeRequest().getPath()).startsWith("/v2/orders?status=open");
        }
    }

    @Nested
    @DisplayName("Errors and market data")
    class ErrorsAndData {

        @Test
        @DisplayName("Server error surfaces as a transient AlpacaApiException")
        void serverError() {
            server.enqueue(json(503, "{\"message\":\"unavailable\"}"));

            assertThatThrownBy(() -> client.getAccount())
                .isInstanceOfSatisfying(AlpacaApiException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(503);
                    assertThat(e.isTransient()).isTrue();
                });
        }

        @Test
        @DisplayName("Forbidden is not transient")
        void forbidden() {
            server.enqueue(json(403, "{\"message\":\"insufficient buying power\"}"));

            assertThatThrownBy(() -> client.placeOrder("AAPL", 1, "buy", "market", null, null))
                .isInstanceOfSatisfying(AlpacaApiException.class, e -> {
                    assertThat(e.isTransient()).isFalse();
                    assertThat(e.getResponseBody()).contains("buying power");
                });
        }

        @Test
        @DisplayName("Latest trade price comes from the IEX feed")
        void latestTrade() throws Exception {
            server.enqueue(json(200, "{\"symbol\":\"AAPL\",\"trade\":{\"t\":\"2024-03-18T14:00:00Z\",\"p\":172.35,\"s\":100}}"));

            Optional<BigDecimal> price = client.getLatestTradePrice("aapl");

            assertThat(price).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("172.35"));
            assertThat(server.takeRequest().getPath()).isEqualTo("/v2/stocks/AAPL/trades/latest?feed=iex");
        }

        @Test
        @DisplayName("Calendar lists sessions with early closes and skips holidays")
        void calendar() throws Exception {
            server.enqueue(json(200, "[{\"date\":\"2024-11-27\",\"open\":\"09:30\",\"close\":\"16:00\","
                + "\"session_open\":\"0400\",\"session_close\":\"2000\",\"settlement_date\":\"2024-11-29\"},"
                + "{\"date\":\"2024-11-29\",\"open\":\"09:30\",\"close\":\"13:00\"}]"));

            List<AlpacaCalendarDay> days = client.getCalendar(LocalDate.of(2024, 11, 27), LocalDate.of(2024, 11, 29));

            assertThat(days).extracting(AlpacaCalendarDay::date)
                .containsExactly(LocalDate.of(2024, 11, 27), LocalDate.of(2024, 11, 29));
            assertThat(days.get(1).close()).isEqualTo(LocalTime.of(13, 0));
            assertThat(server.takeRequest().getPath()).isEqualTo("/v2/calendar?start=2024-11-27&end=2024-11-29");
        }

        @Test
        @DisplayName("Missing trade is empty")
        void noTrade() throws Exception {
            server.enqueue(json(200, "{\"symbol\":\"XYZ\"}"));

            assertThat(client.getLatestTradePrice("XYZ")).isEmpty();
        }
    }
}
