package com.saurabhshcs.adtech.marketplace.domain;
import org.junit.jupiter.api.Test;
import java.math.BigDecimal;
import java.util.EnumSet;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
class CustomerTest {
    @Test void constructor_rejectsMissingOrNegativeBudgetAndMissingPreferences() {
        assertThatThrownBy(() -> new Customer(1, "Ana", null, EnumSet.noneOf(ProductCategory.class)))
                .isInstanceOf(NullPointerException.class).hasMessage("Budget must not be null");
        assertThatThrownBy(() -> new Customer(1, "Ana", BigDecimal.TEN, null))
                .isInstanceOf(NullPointerException.class).hasMessage("Preferences must not be null");
        assertThatThrownBy(() -> new Customer(1, "Ana", new BigDecimal("-1"), EnumSet.noneOf(ProductCategory.class)))
                .isInstanceOf(IllegalArgumentException.class);
    }
    @Test void debit_neverDrivesBudgetNegative() {
        Customer customer = new Customer(1, "Ana", new BigDecimal("50"), EnumSet.of(ProductCategory.BOOKS));
        customer.debit(new BigDecimal("20"));
        assertThatThrownBy(() -> customer.debit(new BigDecimal("30.01"))).isInstanceOf(IllegalStateException.class);
        assertThat(customer.getBudget()).isEqualByComparingTo("30");
    }
}
