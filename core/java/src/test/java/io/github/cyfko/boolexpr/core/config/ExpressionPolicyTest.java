package io.github.cyfko.boolexpr.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExpressionPolicy Tests")
class ExpressionPolicyTest {

    @Test
    @DisplayName("Presets should expose their documented settings")
    void presetsShouldExposeSettings() {
        assertAll(
                () -> assertEquals(5000, ExpressionPolicy.defaults().maxExpressionLength()),
                () -> assertTrue(ExpressionPolicy.defaults().strictKeywordBoundaries()),
                () -> assertEquals(18, ExpressionPolicy.defaults().largeTableThreshold()),
                () -> assertEquals(256, ExpressionPolicy.defaults().maxNestingDepth()),
                () -> assertEquals(64, ExpressionPolicy.strict().maxNestingDepth()),
                () -> assertEquals(512, ExpressionPolicy.relaxed().maxNestingDepth()),
                () -> assertEquals(256, ExpressionPolicy.legacy().maxNestingDepth()),
                () -> assertEquals(1000, ExpressionPolicy.strict().maxExpressionLength()),
                () -> assertEquals(10000, ExpressionPolicy.relaxed().maxExpressionLength()),
                () -> assertFalse(ExpressionPolicy.legacy().strictKeywordBoundaries()),
                () -> assertEquals("LEGACY_POLICY", ExpressionPolicy.legacy().policyName())
        );
    }

    @Test
    @DisplayName("Builder should start from default values")
    void builderShouldStartFromDefaults() {
        ExpressionPolicy policy = ExpressionPolicy.builder().build();

        assertEquals("CUSTOM_POLICY", policy.policyName());
        assertEquals(ExpressionPolicy.defaults().maxExpressionLength(), policy.maxExpressionLength());
        assertEquals(ExpressionPolicy.defaults().largeTableThreshold(), policy.largeTableThreshold());
        assertEquals(ExpressionPolicy.defaults().maxNestingDepth(), policy.maxNestingDepth());
        assertTrue(policy.strictKeywordBoundaries());
    }

    @Test
    @DisplayName("Builder should override every setting")
    void builderShouldOverrideSettings() {
        ExpressionPolicy policy = ExpressionPolicy.builder()
                .policyName("ci")
                .maxExpressionLength(64)
                .maxNestingDepth(8)
                .strictKeywordBoundaries(false)
                .largeTableThreshold(4)
                .build();

        assertEquals(new ExpressionPolicy("ci", 64, 8, false, 4), policy);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    @DisplayName("Should reject non positive maximum length")
    void shouldRejectInvalidLength(int length) {
        assertThrows(IllegalArgumentException.class,
                () -> ExpressionPolicy.builder().maxExpressionLength(length).build());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    @DisplayName("Should reject non positive nesting depth")
    void shouldRejectInvalidNestingDepth(int depth) {
        assertThrows(IllegalArgumentException.class,
                () -> ExpressionPolicy.builder().maxNestingDepth(depth).build());
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 27})
    @DisplayName("Should reject threshold outside the identifier range")
    void shouldRejectInvalidThreshold(int threshold) {
        assertThrows(IllegalArgumentException.class,
                () -> ExpressionPolicy.builder().largeTableThreshold(threshold).build());
    }

    @Test
    @DisplayName("Should require a policy name")
    void shouldRequireName() {
        assertThrows(IllegalArgumentException.class, () -> ExpressionPolicy.builder().policyName(" ").build());
        assertThrows(IllegalArgumentException.class, () -> new ExpressionPolicy(null, 10, 8, true, 1));
    }
}
