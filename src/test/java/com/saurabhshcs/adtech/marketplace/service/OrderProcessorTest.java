package com.saurabhshcs.adtech.marketplace.service;
import com.saurabhshcs.adtech.marketplace.domain.Customer;
import com.saurabhshcs.adtech.marketplace.domain.Order;
import com.saurabhshcs.adtech.marketplace.domain.OrderItem;
import com.saurabhshcs.adtech.marketplace.domain.OrderStatus;
import com.saurabhshcs.adtech.marketplace.domain.ProductCategory;
import com.saurabhshcs.adtech.marketplace.domain.Seller;
import com.saurabhshcs.adtech.marketplace.exception.StockInvariantViolationException;
import com.saurabhshcs.adtech.marketplace.repository.Catalog;
import com.saurabhshcs.adtech.marketplace.repository.MarketplaceRegistry;
import com.saurabhshcs.adtech.marketplace.repository.OrderLedger;
import com.saurabhshcs.adtech.marketplace.result.FailureReason;
import com.saurabhshcs.adtech.marketplace.result.PurchaseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import static com.saurabhshcs.adtech.marketplace.service.MarketplaceFixture.product;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
class OrderProcessorTest {
    private MarketplaceFixture fixture;
    private OrderProcessor processor;
    @BeforeEach void setUp() {
        fixture = new MarketplaceFixture().withSeller("TechStore", product(1, "100", 1), product(2, "100", 5), product(3, "19.99", 10));
        processor = fixture.orderProcessor;
    }
    @Test void successfulPurchase_commitsStockBudgetAndLedger() {
        Customer customer = fixture.customer(1, "150");
        fixture.cartService.add(1, 1);
        PurchaseResult result = processor.placeOrder(1);
        assertThat(result.isSuccess()).isTrue();
        Order order = result.getOrder();
        assertThat(order.getOrderId()).isEqualTo(1);
        assertThat(order.getTotalAmount()).isEqualByComparingTo("100");
        assertThat(order.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(fixture.stockOf(1)).isZero();
        assertThat(customer.getBudget()).isEqualByComparingTo("50");
        assertThat(customer.getCart().isEmpty()).isTrue();
        assertThat(customer.getPurchaseHistory()).extracting(OrderItem::productId).containsExactly(1L);
        assertThat(fixture.ledger.findAll()).containsExactly(order);
    }
    @Test void productSoldOutBeforeCheckout_leavesEverythingUnchanged() {
        Customer customer = fixture.customer(1, "150");
        fixture.customer(2, "500");
        fixture.cartService.add(1, 1);
        fixture.cartService.add(2, 1);
        assertThat(processor.placeOrder(2).isSuccess()).isTrue();
        PurchaseResult result = processor.placeOrder(1);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).isEqualTo(FailureReason.PRODUCT_UNAVAILABLE);
        assertThat(result.order()).isEmpty();
        assertThat(customer.getBudget()).isEqualByComparingTo("150");
        assertThat(customer.getCart().size()).isEqualTo(1);
        assertThat(processor.ordersFor(1)).isEmpty();
        assertThat(fixture.stockOf(1)).isZero();
    }
    @Test void emptyCart_isRejectedWithoutSideEffects() {
        Customer customer = fixture.customer(1, "150");
        PurchaseResult result = processor.placeOrder(1);
        assertThat(result.getFailureReason()).isEqualTo(FailureReason.EMPTY_CART);
        assertThat(processor.placeOrder(1).getFailureReason()).isEqualTo(FailureReason.EMPTY_CART);
        assertThat(customer.getBudget()).isEqualByComparingTo("150");
        assertThat(fixture.ledger.count()).isZero();
        assertThat(fixture.ledger.nextOrderId()).isEqualTo(1);
    }
    @Test void totalAboveBudget_isRejectedWithoutSideEffects() {
        Customer customer = fixture.customer(1, "150");
        fixture.cartService.add(1, 2);
        fixture.cartService.add(1, 2);
        PurchaseResult result = processor.placeOrder(1);
        assertThat(result.getFailureReason()).isEqualTo(FailureReason.INSUFFICIENT_BUDGET);
        assertThat(fixture.stockOf(2)).isEqualTo(5);
        assertThat(customer.getBudget()).isEqualByComparingTo("150");
        assertThat(customer.getCart().size()).isEqualTo(2);
        assertThat(fixture.ledger.count()).isZero();
    }
    @Test void moreUnitsInCartThanStock_isRejectedAsUnavailable() {
        Customer customer = fixture.customer(1, "1000");
        assertThat(fixture.cartService.add(1, 1).isSuccess()).isTrue();
        assertThat(fixture.cartService.add(1, 1).isSuccess()).isTrue();
        PurchaseResult result = processor.placeOrder(1);
        assertThat(result.getFailureReason()).isEqualTo(FailureReason.PRODUCT_UNAVAILABLE);
        assertThat(fixture.stockOf(1)).isEqualTo(1);
        assertThat(customer.getBudget()).isEqualByComparingTo("1000");
    }
    @Test void orderTotalMatchesItemPrices_andIdsIncrease() {
        Customer customer = fixture.customer(1, "1000");
        fixture.cartService.add(1, 3); fixture.cartService.add(1, 3); fixture.cartService.add(1, 2);
        Order first = processor.placeOrder(1).getOrder();
        fixture.cartService.add(1, 3);
        Order second = processor.placeOrder(1).getOrder();
        BigDecimal expectedFirst = first.getItems().stream().map(OrderItem::price).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(first.getTotalAmount()).isEqualByComparingTo(expectedFirst).isEqualByComparingTo("139.98");
        assertThat(second.getOrderId()).isGreaterThan(first.getOrderId());
        assertThat(customer.getBudget()).isEqualByComparingTo(new BigDecimal("1000").subtract(first.getTotalAmount()).subtract(second.getTotalAmount()));
        assertThat(fixture.stockOf(3)).isEqualTo(7);
        assertThat(processor.ordersFor(1)).extracting(Order::getOrderId).containsExactly(1L, 2L);
    }
    @Test void failedStockCommit_doesNotConsumeAnOrderId() {
        Catalog failingOnce = new Catalog() {
            private boolean failed;
            @Override public synchronized void commitDecrement(Collection<Long> productIds) {
                if (!failed) { failed = true; throw new StockInvariantViolationException("stock changed underneath checkout"); }
                super.commitDecrement(productIds);
            }
        };
        MarketplaceRegistry registry = new MarketplaceRegistry(failingOnce);
        OrderLedger ledger = new OrderLedger();
        registry.registerSeller(new Seller(MarketplaceFixture.SELLER_ID, "TechStore"), List.of(product(1, "100", 2)));
        Customer customer = new Customer(1, "Ana", new BigDecimal("500"), EnumSet.noneOf(ProductCategory.class));
        registry.registerCustomer(customer);
        new CartService(registry, failingOnce).add(1, 1);
        OrderProcessor failingProcessor = new OrderProcessor(registry, failingOnce, ledger);
        assertThatThrownBy(() -> failingProcessor.placeOrder(1)).isInstanceOf(StockInvariantViolationException.class);
        assertThat(customer.getBudget()).isEqualByComparingTo("500");
        assertThat(ledger.count()).isZero();
        assertThat(failingProcessor.placeOrder(1).getOrder().getOrderId()).isEqualTo(1);
    }
    @Test void budgetIsSpentExactly() {
        Customer customer = fixture.customer(1, "100");
        fixture.cartService.add(1, 2);
        assertThat(processor.placeOrder(1).isSuccess()).isTrue();
        assertThat(customer.getBudget()).isEqualByComparingTo("0");
        assertThat(fixture.cartService.add(1, 3).getFailureReason()).isEqualTo(FailureReason.INSUFFICIENT_BUDGET);
    }
}
