package com.polytrade.scanner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Opportunity Tests")
class OpportunityTest {

    @Test
    @DisplayName("Expected value of a YES bet")
    void testExpectedValueYes() {
        // p = 0.6, odds = 1 -> EV per dollar 0.2
        Opportunity opp = new Opportunity("m1", Side.BUY, 0.1, 1.0, 0.5, 1000);

        assertThat(opp.expectedValuePerDollar()).isCloseTo(0.2, within(1e-9));
        assertThat(opp.expectedValue(50)).isCloseTo(10.0, within(1e-9));
    }

    @Test
    @DisplayName("Expected value of a NO bet")
    void testExpectedValueNo() {
        // YES estimate 0.2 at price 0.4: NO wins with p = 0.8 at odds 0.4/0.6
        Opportunity opp = new Opportunity("m1", Side.SELL, -0.2, 1.0, 0.4, 1000);

        assertThat(opp.winProbability()).isCloseTo(0.8, within(1e-9));
        assertThat(opp.expectedValuePerDollar()).isCloseTo(0.8 * (0.4 / 0.6) - 0.2, within(1e-9));
    }

    @Test
    @DisplayName("Construction validates ranges")
    void testValidation() {
        assertThatThrownBy(() -> new Opportunity(" ", Side.BUY, 0.1, 0.5, 0.5, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Opportunity("m1", Side.BUY, 0.1, 1.5, 0.5, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Opportunity("m1", Side.BUY, 0.1, 0.5, 0.0, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Opportunity("m1", Side.BUY, Double.NaN, 0.5, 0.5, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
