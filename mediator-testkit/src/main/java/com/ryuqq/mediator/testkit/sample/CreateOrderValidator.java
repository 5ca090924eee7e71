package com.ryuqq.mediator.testkit.sample;

import com.ryuqq.mediator.adapter.inmemory.validation.RuleValidator;
import com.ryuqq.mediator.core.cancellation.CancellationToken;
import com.ryuqq.mediator.core.validation.ValidationFailure;
import com.ryuqq.mediator.core.validation.Validator;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * CreateOrderCommand 검증 규칙.
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public final class CreateOrderValidator implements Validator<CreateOrderCommand> {

    public static final String CUSTOMER_ID_EMPTY = "Customer ID cannot be empty.";
    public static final String DESCRIPTION_EMPTY = "Description cannot be empty.";
    public static final String AMOUNT_NEGATIVE = "Amount cannot be negative.";

    private static final UUID EMPTY_ID = new UUID(0L, 0L);

    private final RuleValidator<CreateOrderCommand> rules = RuleValidator.<CreateOrderCommand>builder()
        .rule("customerId", c -> c.customerId() != null && !EMPTY_ID.equals(c.customerId()), CUSTOMER_ID_EMPTY)
        .notBlank("description", CreateOrderCommand::description, DESCRIPTION_EMPTY)
        .rule("amount", c -> c.amount() >= 0, AMOUNT_NEGATIVE)
        .build();

    @Override
    public CompletableFuture<List<ValidationFailure>> validate(CreateOrderCommand request, CancellationToken cancellation) {
        return rules.validate(request, cancellation);
    }
}
