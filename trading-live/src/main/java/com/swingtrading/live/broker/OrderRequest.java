package com.swingtrading.live.broker;

import com.swingtrading.model.TradeAction;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validated market order for the broker gateway. Long-only: BUY opens, SELL closes.
 */
public record OrderRequest(
    @NotBlank(message = "Symbol is required")
    @Pattern(regexp = "^[A-Z0-9&_-]{1,20}$", message = "Symbol must be 1-20 uppercase NSE characters")
    String symbol,

    @NotNull(message = "Side is required")
    TradeAction side,

    @Positive(message = "Quantity must be positive")
    @DecimalMax(value = "10000000", message = "Quantity cannot exceed 10,000,000")
    long quantity,

    @Positive(message = "Reference price must be positive")
    double referencePrice,

    String reason
) {
    private static final ValidatorFactory VALIDATOR_FACTORY = Validation.buildDefaultValidatorFactory();

    public static OrderRequest buy(String symbol, long quantity, double price, String reason) {
        return new OrderRequest(symbol, TradeAction.BUY, quantity, price, reason);
    }

    public static OrderRequest sell(String symbol, long quantity, double price, String reason) {
        return new OrderRequest(symbol, TradeAction.SELL, quantity, price, reason);
    }

    /**
     * Check the bean constraints.
     *
     * @throws IllegalArgumentException listing every violated constraint
     */
    public OrderRequest validate() {
        Validator validator = VALIDATOR_FACTORY.getValidator();
        Set<ConstraintViolation<OrderRequest>> violations = validator.validate(this);
        if (!violations.isEmpty()) {
            String messages = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Invalid order: " + messages);
        }
        return this;
    }
}
