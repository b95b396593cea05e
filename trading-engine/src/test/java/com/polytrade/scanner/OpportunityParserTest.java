package com.polytrade.scanner;

import com.polytrade.persistence.JsonMappers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("OpportunityParser Tests")
class OpportunityParserTest {

    private final OpportunityParser parser = new OpportunityParser(JsonMappers.create());

    @Nested
    @DisplayName("Field handling")
    class Fields {

        @Test
        @DisplayName("Accepts aliases and numeric strings")
        void testAliases() {
            List<Opportunity> parsed = parser.parseAll("""
                [{"condition_id": "0xabc", "question": "Will BTC close above 100k?",
                  "side": "yes", "edge": "0.08", "confidence": 0.7, "price": 0.45, "liquidity": 12000}]
                """);

            assertThat(parsed).hasSize(1);
            Opportunity opp = parsed.get(0);
            assertThat(opp.marketId()).isEqualTo("0xabc");
            assertThat(opp.marketTitle()).isEqualTo("Will BTC close above 100k?");
            assertThat(opp.side()).isEqualTo(Side.BUY);
            assertThat(opp.edge()).isCloseTo(0.08, within(1e-12));
            assertThat(opp.currentPrice()).isEqualTo(0.45);
            assertThat(opp.liquidity()).isEqualTo(12000.0);
        }

        @Test
        @DisplayName("Side is derived from the edge sign when absent")
        void testDerivedSide() {
            List<Opportunity> parsed = parser.parseAll("""
                [{"market_id": "m1", "edge": -0.1, "confidence": 0.5, "current_price": 0.6}]
                """);

            assertThat(parsed.get(0).side()).isEqualTo(Side.SELL);
            assertThat(parsed.get(0).marketTitle()).isEqualTo("m1");
            assertThat(parsed.get(0).liquidity()).isZero();
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class Malformed {

        @Test
        @DisplayName("Malformed entries are skipped, valid ones kept")
        void testSkipsMalformed() {
            List<Opportunity> parsed = parser.parseAll("""
                [
                  {"market_id": "ok", "edge": 0.05, "confidence": 0.9, "current_price": 0.3},
                  {"edge": 0.05, "confidence": 0.9, "current_price": 0.3},
                  {"market_id": "bad-price", "edge": 0.05, "confidence": 0.9, "current_price": 1.2},
                  {"market_id": "bad-number", "edge": "lots", "confidence": 0.9, "current_price": 0.3},
                  {"market_id": "bad-side", "side": "MAYBE", "edge": 0.05, "confidence": 0.9, "current_price": 0.3},
                  42
                ]
                """);

            assertThat(parsed).extracting(Opportunity::marketId).containsExactly("ok");
        }

        @Test
        @DisplayName("A response that is not a JSON array is rejected")
        void testNotArray() {
            assertThatThrownBy(() -> parser.parseAll("{\"market_id\": \"m1\"}"))
                .isInstanceOf(MalformedOpportunityException.class);
            assertThatThrownBy(() -> parser.parseAll("not json"))
                .isInstanceOf(MalformedOpportunityException.class);
        }

        @Test
        @DisplayName("Missing required numeric field names the field")
        void testMissingField() {
            var node = JsonMappers.create().createObjectNode()
                .put("market_id", "m1")
                .put("edge", 0.1)
                .put("current_price", 0.5);

            assertThatThrownBy(() -> parser.parse(node))
                .isInstanceOf(MalformedOpportunityException.class)
                .hasMessageContaining("confidence");
        }
    }
}
