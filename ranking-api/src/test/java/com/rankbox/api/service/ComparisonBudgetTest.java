package com.rankbox.api.service;

import com.rankbox.api.dto.ModeOption;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComparisonBudgetTest {

    @Test
    void budgetsForATenItemList() {
        assertThat(ComparisonBudget.QUICK.comparisonsFor(10)).isEqualTo(20);
        assertThat(ComparisonBudget.BALANCED.comparisonsFor(10)).isEqualTo(64);
        assertThat(ComparisonBudget.THOROUGH.comparisonsFor(10)).isEqualTo(84);
    }

    @Test
    void smallListsGetTheMinimumBudget() {
        assertThat(ComparisonBudget.QUICK.comparisonsFor(2)).isEqualTo(20);
        assertThat(ComparisonBudget.BALANCED.comparisonsFor(2)).isEqualTo(30);
        assertThat(ComparisonBudget.THOROUGH.comparisonsFor(2)).isEqualTo(40);
    }

    @Test
    void largeListsAreCapped() {
        assertThat(ComparisonBudget.QUICK.comparisonsFor(100)).isEqualTo(150);
        assertThat(ComparisonBudget.BALANCED.comparisonsFor(100)).isEqualTo(965);
        assertThat(ComparisonBudget.THOROUGH.comparisonsFor(100)).isEqualTo(1165);

        assertThat(ComparisonBudget.BALANCED.comparisonsFor(400)).isEqualTo(1500);
        assertThat(ComparisonBudget.THOROUGH.comparisonsFor(400)).isEqualTo(2000);
    }

    @Test
    void optionCarriesBudgetAndEstimate() {
        ModeOption option = ComparisonBudget.BALANCED.toOption(10);

        assertThat(option.id()).isEqualTo("balanced");
        assertThat(option.title()).isEqualTo("Balanced Mode");
        assertThat(option.comparisons()).isEqualTo(64);
        assertThat(option.estimatedMinutes()).isEqualTo(7);
    }

    @Test
    void fromIdIgnoresCaseAndWhitespace() {
        assertThat(ComparisonBudget.fromId("Thorough")).isEqualTo(ComparisonBudget.THOROUGH);
        assertThat(ComparisonBudget.fromId(" quick ")).isEqualTo(ComparisonBudget.QUICK);
    }

    @Test
    void fromIdRejectsUnknownModes() {
        assertThatThrownBy(() -> ComparisonBudget.fromId("exhaustive"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exhaustive");
        assertThatThrownBy(() -> ComparisonBudget.fromId(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
