package com.lucidityplatform.common.flux;

import com.lucidityplatform.common.model.LucidityTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FluxModifiersTest {

    // ── companions ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("CompanionModifier")
    class Companions {

        @Test
        @DisplayName("alone → 0")
        void alone() {
            assertEquals(0.0, CompanionModifier.compute(List.of()), 1e-9);
        }

        @Test
        @DisplayName("+0.1 per stable companion, capped at +0.3")
        void supportCapped() {
            assertEquals(0.2, CompanionModifier.compute(
                List.of(LucidityTier.STABLE, LucidityTier.UNEASY)), 1e-9);
            assertEquals(0.3, CompanionModifier.compute(List.of(
                LucidityTier.STABLE, LucidityTier.STABLE, LucidityTier.STABLE,
                LucidityTier.STABLE, LucidityTier.STABLE)), 1e-9);
        }

        @Test
        @DisplayName("fractured companions still count as support")
        void fracturedSupports() {
            assertEquals(0.1, CompanionModifier.compute(List.of(LucidityTier.FRACTURED)), 1e-9);
        }

        @Test
        @DisplayName("any impaired companion subtracts 0.2 once")
        void impairedPenalty() {
            assertEquals(-0.2, CompanionModifier.compute(
                List.of(LucidityTier.DERANGED, LucidityTier.TERMINAL)), 1e-9);
            assertEquals(-0.1, CompanionModifier.compute(
                List.of(LucidityTier.STABLE, LucidityTier.DERANGED)), 1e-9);
        }
    }

    // ── resistance ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("AdaptiveResistance")
    class Resistance {

        private static final int WINDOW = AdaptiveResistance.DEFAULT_WINDOW;

        @Test
        @DisplayName("first window keeps the full loss")
        void firstWindow() {
            assertEquals(-1.0, AdaptiveResistance.apply(-1.0, 1, WINDOW), 1e-9);
            assertEquals(-1.0, AdaptiveResistance.apply(-1.0, 10, WINDOW), 1e-9);
        }

        @Test
        @DisplayName("each full window reduces loss by 25%, bottoming at 50%")
        void steppedReduction() {
            assertEquals(-0.75, AdaptiveResistance.apply(-1.0, 11, WINDOW), 1e-9);
            assertEquals(-0.5, AdaptiveResistance.apply(-1.0, 21, WINDOW), 1e-9);
            assertEquals(-0.5, AdaptiveResistance.apply(-1.0, 500, WINDOW), 1e-9);
        }

        @Test
        @DisplayName("positive flux is never dampened")
        void positiveUntouched() {
            assertEquals(0.6, AdaptiveResistance.apply(0.6, 40, WINDOW), 1e-9);
        }
    }
}
