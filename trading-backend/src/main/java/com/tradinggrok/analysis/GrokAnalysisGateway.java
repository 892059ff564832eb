package com.tradinggrok.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradinggrok.core.error.AnalysisUnavailable;
import com.tradinggrok.core.gateway.AnalysisGateway;
import com.tradinggrok.core.model.MarketContext;
import com.tradinggrok.core.model.Recommendation;
import com.tradinggrok.core.model.RecommendedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * {@link AnalysisGateway} that asks Grok for a swing-trading call on one symbol.
 *
 * <p>The model is asked for a single JSON object; a {@code recommendations} array is also
 * accepted and searched for the requested symbol. Only action and confidence influence trading.
 */
public final class GrokAnalysisGateway implements AnalysisGateway {
    private static final Logger logger = LoggerFactory.getLogger(GrokAnalysisGateway.class);
    private static final String SYSTEM_PROMPT =
        "You are Grok, an expert AI trading analyst specializing in tech stock swing trading.";
    private static final double DEFAULT_CONFIDENCE = 0.5;
    private static final DateTimeFormatter PROMPT_TIME =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z", Locale.ROOT).withZone(ZoneId.of("America/New_York"));

    private final GrokClient client;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GrokAnalysisGateway(GrokClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Recommendation getRecommendation(String symbol, MarketContext context) {
        String content;
        try {
            content = client.complete(SYSTEM_PROMPT, buildPrompt(symbol, context));
        } catch (IOException e) {
            throw new AnalysisUnavailable(symbol, "Grok request failed for " + symbol + ": " + e.getMessage(), e);
        }

        Recommendation recommendation = parse(symbol, content);
        logger.info("🧠 Grok {} {} (confidence {})", recommendation.action(), recommendation.symbol(),
            String.format(Locale.ROOT, "%.2f", recommendation.confidence()));
        return recommendation;
    }

    String buildPrompt(String symbol, MarketContext context) {
        var prompt = new StringBuilder()
            .append("You are an expert swing trader analyzing tech stocks for positions lasting 4 days to 3 weeks.\n")
            .append("Current time: ").append(PROMPT_TIME.format(context.cycleTime())).append('\n')
            .append("Symbol: ").append(symbol).append('\n');
        if (context.lastPrice() != null) {
            prompt.append("Last price: ").append(context.lastPrice().toPlainString()).append('\n');
        }
        prompt.append(context.holdingPosition()
                ? "We currently hold a long position in this stock.\n"
                : "We do not hold this stock.\n")
            .append("\nAnalyze the technical setup and current sentiment, then answer with JSON only:\n")
            .append("{\"symbol\": \"").append(symbol).append("\", \"action\": \"BUY/SELL/HOLD\", ")
            .append("\"target_price\": 120.00, \"stop_loss\": 95.00, \"holding_period_days\": 14, ")
            .append("\"reasoning\": \"short analysis\", \"confidence\": 0.75}\n")
            .append("SELL means exit an existing long position. Only recommend BUY for liquid stocks ")
            .append("with a clear swing-trading setup.");
        return prompt.toString();
    }

    Recommendation parse(String symbol, String content) {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new AnalysisUnavailable(symbol, "No JSON found in Grok response for " + symbol);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(content.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new AnalysisUnavailable(symbol, "Malformed JSON in Grok response for " + symbol, e);
        }

        JsonNode node = root;
        if (root.path("recommendations").isArray()) {
            node = null;
            for (JsonNode candidate : root.path("recommendations")) {
                if (symbol.equalsIgnoreCase(candidate.path("symbol").asText())) {
                    node = candidate;
                    break;
                }
            }
            if (node == null) {
                logger.debug("Grok returned no recommendation for {}, holding", symbol);
                return new Recommendation(symbol, RecommendedAction.HOLD, 0.0, null, null,
                    "No recommendation for " + symbol, clock.instant());
            }
        }

        String answeredSymbol = node.path("symbol").asText(symbol);
        if (!symbol.equalsIgnoreCase(answeredSymbol)) {
            throw new AnalysisUnavailable(symbol, "Grok answered for " + answeredSymbol + " instead of " + symbol);
        }

        double confidence = DEFAULT_CONFIDENCE;
        JsonNode confidenceNode = node.path("confidence");
        if (!confidenceNode.isMissingNode() && !confidenceNode.isNull()) {
            if (!confidenceNode.isNumber()) {
                throw new AnalysisUnavailable(symbol, "Non-numeric confidence from Grok: " + confidenceNode);
            }
            confidence = confidenceNode.asDouble();
        }

        try {
            return new Recommendation(
                symbol,
                RecommendedAction.parse(node.path("action").asText(null)),
                confidence,
                decimal(node.path("target_price")),
                decimal(node.path("stop_loss")),
                node.path("reasoning").asText(""),
                clock.instant());
        } catch (IllegalArgumentException e) {
            throw new AnalysisUnavailable(symbol, "Invalid recommendation from Grok: " + e.getMessage(), e);
        }
    }

    private static BigDecimal decimal(JsonNode node) {
        return node.isNumber() ? node.decimalValue() : null;
    }
}
