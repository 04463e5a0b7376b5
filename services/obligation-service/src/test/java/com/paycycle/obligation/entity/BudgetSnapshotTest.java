package com.paycycle.obligation.entity;

import com.paycycle.obligation.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BudgetSnapshot Tests")
class BudgetSnapshotTest {

    @Test
    @DisplayName("Total only sums included items")
    void shouldSumIncludedItemsOnly() {
        BudgetSnapshot snapshot = BudgetSnapshot.builder()
                .items(new ArrayList<>(List.of(
                        TestDataBuilder.createLineItem("Utilities", "Internet", "1500", true),
                        TestDataBuilder.createLineItem("Food", "Groceries", "6500", true),
                        TestDataBuilder.createLineItem("Leisure", "Concert", "2000", false))))
                .build();

        snapshot.recomputeTotal();

        assertThat(snapshot.getTotalAmount()).isEqualByComparingTo("8000");
        assertThat(snapshot.getItemsByCategory()).containsOnlyKeys("Utilities", "Food", "Leisure");
    }

    @Test
    @DisplayName("Actual salary overrides projected salary without touching the total")
    void shouldPreferActualSalary() {
        BudgetSnapshot snapshot = BudgetSnapshot.builder()
                .items(new ArrayList<>(List.of(TestDataBuilder.createLineItem("Rent", "Rent", "8000", true))))
                .projectedSalary(new BigDecimal("11000"))
                .build();
        snapshot.recomputeTotal();
        assertThat(snapshot.getEffectiveIncome()).isEqualByComparingTo("11000");

        snapshot.setActualSalary(new BigDecimal("9500"));

        assertThat(snapshot.getEffectiveIncome()).isEqualByComparingTo("9500");
        assertThat(snapshot.getTotalAmount()).isEqualByComparingTo("8000");
    }

    @Test
    @DisplayName("Income is zero when no salary is known")
    void shouldDefaultIncomeToZero() {
        assertThat(BudgetSnapshot.builder().build().getEffectiveIncome()).isEqualByComparingTo("0");
    }
}
