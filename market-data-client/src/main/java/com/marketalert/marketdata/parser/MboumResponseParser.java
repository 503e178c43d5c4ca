package com.marketalert.marketdata.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketalert.common.model.DerivativeEvent;
import com.marketalert.common.model.InsiderTrade;
import com.marketalert.common.model.InstrumentSnapshot;
import com.marketalert.common.model.TransactionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Strict parse boundary between MBOUM JSON payloads and the typed domain records.
 *
 * <p>Every endpoint wraps its records in a {@code body} array. Each record is parsed on its
 * own: a record missing a required field or carrying an unparseable number is dropped and
 * logged at DEBUG, and the rest of the batch is still returned. A payload that is not JSON
 * at all raises {@link MalformedPayloadException}, which the client treats as "no data".
 *
 * <p>MBOUM renders many numbers as display strings ({@code "$1,234.50"}, {@code "12.5%"},
 * {@code "1,200"}); {@link #number} accepts both forms.
 */
public class MboumResponseParser {

    private static final Logger log = LoggerFactory.getLogger(MboumResponseParser.class);

    private final ObjectMapper objectMapper;

    public MboumResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<InstrumentSnapshot> parseSnapshots(String json) {
        return parseBody(json, "screener", node -> new InstrumentSnapshot(
            requiredText(node, "symbol"),
            number(node, "regularMarketPrice"),
            optionalNumber(node, "regularMarketChangePercent"),
            (long) optionalNumber(node, "regularMarketVolume"),
            optionalNumber(node, "bid"),
            (long) optionalNumber(node, "bidSize"),
            optionalNumber(node, "ask"),
            (long) optionalNumber(node, "askSize")
        ));
    }

    public List<InsiderTrade> parseInsiderTrades(String json) {
        return parseBody(json, "insider-trades", node -> new InsiderTrade(
            firstText(node, "ticker", "symbol").toUpperCase(Locale.ROOT),
            optionalText(node, "insiderName", "name"),
            TransactionType.fromText(optionalText(node, "transactionType", "type")),
            (long) firstNumber(node, "sharesTraded", "shares"),
            optionalNumber(node, "price")
        ));
    }

    public List<DerivativeEvent> parseUnusualOptions(String json) {
        return parseBody(json, "unusual-options", node -> new DerivativeEvent(
            firstText(node, "baseSymbol", "underlying").toUpperCase(Locale.ROOT),
            optionalText(node, "symbol", "contract"),
            optionalText(node, "symbolType", "type"),
            optionalNumber(node, "strikePrice"),
            optionalText(node, "expirationDate", "expiration"),
            (long) number(node, "volume"),
            (long) optionalNumber(node, "openInterest")
        ));
    }

    /**
     * A quote is considered halted when MBOUM flags {@code halted}/{@code tradingHalted} or
     * reports a {@code marketState} of {@code HALTED}. An empty body means "not halted".
     */
    public boolean parseHaltStatus(String json, String symbol) {
        JsonNode body = readTree(json).path("body");
        JsonNode quote = body.isArray() ? findSymbol(body, symbol) : body;
        if (quote == null || quote.isMissingNode() || quote.isNull()) {
            return false;
        }
        if (quote.path("halted").asBoolean(false) || quote.path("tradingHalted").asBoolean(false)) {
            return true;
        }
        return "HALTED".equalsIgnoreCase(quote.path("marketState").asText(""));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private <T> List<T> parseBody(String json, String endpoint, Function<JsonNode, T> mapper) {
        JsonNode body = readTree(json).path("body");
        if (!body.isArray()) {
            log.warn("MBOUM_PAYLOAD_NO_BODY endpoint={}", endpoint);
            return List.of();
        }
        List<T> result = new ArrayList<>(body.size());
        for (JsonNode node : body) {
            try {
                result.add(mapper.apply(node));
            } catch (RuntimeException ex) {
                log.debug("MBOUM_RECORD_SKIPPED endpoint={} reason={} record={}", endpoint, ex.getMessage(), node);
            }
        }
        if (result.size() < body.size()) {
            log.info("MBOUM_RECORDS_DROPPED endpoint={} dropped={} kept={}",
                     endpoint, body.size() - result.size(), result.size());
        }
        return result;
    }

    private JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedPayloadException("empty payload");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("payload is not valid JSON", e);
        }
    }

    private static JsonNode findSymbol(JsonNode array, String symbol) {
        for (JsonNode node : array) {
            if (symbol.equalsIgnoreCase(node.path("symbol").asText())) {
                return node;
            }
        }
        return null;
    }

    private static String requiredText(JsonNode node, String field) {
        String value = node.path(field).asText("").trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing " + field);
        }
        return value;
    }

    private static String firstText(JsonNode node, String primary, String fallback) {
        String value = optionalText(node, primary, fallback);
        if (value == null) {
            throw new IllegalArgumentException("missing " + primary);
        }
        return value;
    }

    private static String optionalText(JsonNode node, String primary, String fallback) {
        for (String field : new String[]{primary, fallback}) {
            JsonNode value = node.path(field);
            if (value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    private static double firstNumber(JsonNode node, String primary, String fallback) {
        return node.hasNonNull(primary) ? number(node, primary) : number(node, fallback);
    }

    private static double optionalNumber(JsonNode node, String field) {
        return node.hasNonNull(field) ? number(node, field) : 0.0;
    }

    static double number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            String cleaned = value.asText().replace("$", "").replace(",", "").replace("%", "").trim();
            try {
                return Double.parseDouble(cleaned);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("unparseable " + field + "='" + value.asText() + "'");
            }
        }
        throw new IllegalArgumentException("missing " + field);
    }
}
