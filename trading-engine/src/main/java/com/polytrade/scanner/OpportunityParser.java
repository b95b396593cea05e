package com.polytrade.scanner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts loosely-typed scanner payloads into {@link Opportunity} records.
 *
 * Accepted field aliases:
 * - market id: {@code market_id} or {@code condition_id}
 * - title: {@code title} or {@code question}
 * - price: {@code current_price} or {@code price}
 * - side: {@code BUY}/{@code YES} or {@code SELL}/{@code NO}; derived from the edge sign when absent
 *
 * Numeric fields may arrive as JSON numbers or numeric strings. Anything else is rejected here
 * so that the risk layer only ever sees well-formed input.
 */
public final class OpportunityParser {
    private static final Logger logger = LoggerFactory.getLogger(OpportunityParser.class);

    private final ObjectMapper mapper;

    public OpportunityParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Opportunity parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedOpportunityException("Opportunity payload must be a JSON object");
        }
        String marketId = text(node, "market_id", "condition_id");
        if (marketId == null || marketId.isBlank()) {
            throw new MalformedOpportunityException("Missing market_id/condition_id");
        }
        String title = text(node, "title", "question");
        double edge = number(node, marketId, "edge");
        double confidence = number(node, marketId, "confidence");
        double price = number(node, marketId, "current_price", "price");
        double liquidity = node.has("liquidity") ? number(node, marketId, "liquidity") : 0.0;
        Side side = side(node, marketId, edge);

        try {
            return new Opportunity(marketId, title, side, edge, confidence, price, liquidity);
        } catch (IllegalArgumentException e) {
            throw new MalformedOpportunityException(marketId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse a JSON array of payloads. Malformed entries are logged and skipped.
     */
    public List<Opportunity> parseAll(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedOpportunityException("Scanner response is not valid JSON", e);
        }
        return parseAll(root);
    }

    public List<Opportunity> parseAll(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new MalformedOpportunityException("Scanner response must be a JSON array");
        }

        List<Opportunity> result = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            try {
                result.add(parse(node));
            } catch (MalformedOpportunityException e) {
                logger.warn("Skipping malformed opportunity: {}", e.getMessage());
            }
        }
        return result;
    }

    private static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }

    private static double number(JsonNode node, String marketId, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isNumber()) {
                return value.doubleValue();
            }
            if (value.isTextual()) {
                try {
                    return Double.parseDouble(value.asText().trim());
                } catch (NumberFormatException e) {
                    throw new MalformedOpportunityException(
                        marketId + ": field '" + name + "' is not numeric: " + value.asText());
                }
            }
            throw new MalformedOpportunityException(marketId + ": field '" + name + "' has wrong type");
        }
        throw new MalformedOpportunityException(marketId + ": missing field '" + names[0] + "'");
    }

    private static Side side(JsonNode node, String marketId, double edge) {
        String raw = text(node, "side");
        if (raw == null || raw.isBlank()) {
            return Side.fromEdge(edge);
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "BUY", "YES" -> Side.BUY;
            case "SELL", "NO" -> Side.SELL;
            default -> throw new MalformedOpportunityException(marketId + ": unknown side '" + raw + "'");
        };
    }
}
