package com.eainde.cds.strategy;

import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.ingest.RawTable;
import com.eainde.cds.model.Percentiles;
import com.eainde.cds.rules.TextField;
import com.eainde.cds.rules.TextRuleSet;
import com.eainde.cds.scan.FieldRanges;
import com.eainde.cds.scan.RowScanRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FieldCascadeTest {

    @Mock
    private ExtractionStrategy<Integer> primary;

    @Mock
    private ExtractionStrategy<Integer> fallback;

    private final DocumentContent document = DocumentContent.textOnly("anything");

    // =========================================================================
    //  Ordering
    // =========================================================================

    @Nested
    @DisplayName("Evaluation order")
    class Order {

        @Test
        @DisplayName("should stop at the first strategy that resolves")
        void firstWins() {
            // Arrange
            when(primary.attempt(any())).thenReturn(Optional.of(42));
            FieldCascade<Integer> cascade = FieldCascade.<Integer>named("field")
                    .then(primary)
                    .then(fallback)
                    .build();

            // Act
            Optional<Integer> value = cascade.resolve(document);

            // Assert
            assertThat(value).contains(42);
            verify(fallback, never()).attempt(any());
        }

        @Test
        @DisplayName("should fall back when the primary strategy is unresolved")
        void fallsBack() {
            when(primary.attempt(any())).thenReturn(Optional.empty());
            when(fallback.attempt(any())).thenReturn(Optional.of(7));
            FieldCascade<Integer> cascade = FieldCascade.<Integer>named("field")
                    .then(primary)
                    .then(fallback)
                    .build();

            assertThat(cascade.resolveOr(document, 0)).isEqualTo(7);
        }

        @Test
        @DisplayName("should use the default when nothing resolves")
        void defaultValue() {
            when(primary.attempt(any())).thenReturn(Optional.empty());
            FieldCascade<Integer> cascade = FieldCascade.<Integer>named("field").then(primary).build();

            assertThat(cascade.resolveOr(document, 0)).isZero();
        }
    }

    // =========================================================================
    //  Builder validation
    // =========================================================================

    @Test
    @DisplayName("should reject a cascade without strategies")
    void emptyCascade() {
        assertThatThrownBy(() -> FieldCascade.<Integer>named("field").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("field");
    }

    @Test
    @DisplayName("should reject a cascade without a name")
    void unnamedCascade() {
        assertThatThrownBy(() -> FieldCascade.<Integer>named(" ").then(primary).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    // =========================================================================
    //  Concrete strategies
    // =========================================================================

    @Nested
    @DisplayName("Text and table strategies")
    class Strategies {

        @Test
        @DisplayName("text counts must be positive")
        void textCountPositive() {
            TextRuleStrategy<Integer> strategy = TextRuleStrategy.count(TextRuleSet.STANDARD.rule(TextField.TUITION));

            assertThat(strategy.attempt(DocumentContent.textOnly("Tuition: $0"))).isEmpty();
            assertThat(strategy.attempt(DocumentContent.textOnly("Tuition: $58,000"))).contains(58000);
        }

        @Test
        @DisplayName("text percentages outside (0, 1] are rejected")
        void textPercentage() {
            TextRuleStrategy<Double> strategy =
                    TextRuleStrategy.percentage(TextRuleSet.STANDARD.rule(TextField.PERCENT_NEED_FULLY_MET));

            assertThat(strategy.attempt(DocumentContent.textOnly("Percent of need fully met 250%"))).isEmpty();
            assertThat(strategy.attempt(DocumentContent.textOnly("Percent of need fully met 80%"))).contains(0.8);
        }

        @Test
        @DisplayName("text pairs must lie in the range")
        void textPairRange() {
            TextRuleStrategy<Percentiles> strategy =
                    TextRuleStrategy.pair(TextRuleSet.STANDARD.rule(TextField.SAT_MATH), FieldRanges.SAT_SECTION);

            assertThat(strategy.attempt(DocumentContent.textOnly("SAT Math 100 - 900"))).isEmpty();
            assertThat(strategy.attempt(DocumentContent.textOnly("SAT Math 620 - 780")))
                    .contains(Percentiles.of(620, 780));
        }

        @Test
        @DisplayName("the capture role must match the strategy kind")
        void roleMismatch() {
            assertThatThrownBy(() -> TextRuleStrategy.count(TextRuleSet.STANDARD.rule(TextField.SAT_MATH)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> TableScanStrategy.pair(RowScanRules.TUITION))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("table strategies are unresolved for documents without tables")
        void noTables() {
            TableScanStrategy<Integer> strategy = TableScanStrategy.count(RowScanRules.TUITION);

            assertThat(strategy.attempt(DocumentContent.textOnly("Tuition 58,000"))).isEmpty();
            assertThat(strategy.attempt(DocumentContent.of("",
                    List.of(RawTable.of(List.of(List.of("Tuition", "58,000"))))))).contains(58000);
        }
    }
}
