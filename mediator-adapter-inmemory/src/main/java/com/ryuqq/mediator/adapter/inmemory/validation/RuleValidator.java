package com.ryuqq.mediator.adapter.inmemory.validation;

import com.ryuqq.mediator.core.cancellation.CancellationToken;
import com.ryuqq.mediator.core.validation.ValidationFailure;
import com.ryuqq.mediator.core.validation.Validator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * In-process implementation of the {@link Validator} SPI built from ordered predicate rules.
 *
 * <p>Every rule is evaluated (no short-circuit), and failures are reported in declaration order.
 * Evaluation happens on the calling thread; the returned future is already complete.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Validator&lt;CreateOrderCommand&gt; validator = RuleValidator.&lt;CreateOrderCommand&gt;builder()
 *     .notNull("customerId", CreateOrderCommand::customerId, "Customer ID is required.")
 *     .rule("customerId", c -&gt; !EMPTY.equals(c.customerId()), "Customer ID cannot be empty.")
 *     .rule("amount", c -&gt; c.amount() &gt; 0, "Amount must be positive.")
 *     .build();
 * </pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>Cancelled token: future fails with {@link CancellationException}, no rule is evaluated</li>
 *   <li>A rule that throws: future fails with that exception (a broken rule is a defect, not a validation failure)</li>
 * </ul>
 *
 * @param <R> the request type under validation
 *
 * @author Mediator Team
 * @since 1.0.0
 */
public final class RuleValidator<R> implements Validator<R> {

    private final List<Rule<R>> rules;

    private RuleValidator(List<Rule<R>> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Creates a new builder.
     *
     * @param <R> the request type
     * @return an empty builder
     */
    public static <R> Builder<R> builder() {
        return new Builder<>();
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if request or cancellation is null
     */
    @Override
    public CompletableFuture<List<ValidationFailure>> validate(R request, CancellationToken cancellation) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation cannot be null");
        }
        if (cancellation.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new CancellationException("Validation was cancelled"));
        }

        List<ValidationFailure> failures = new ArrayList<>();
        try {
            for (Rule<R> rule : rules) {
                if (!rule.predicate().test(request)) {
                    failures.add(ValidationFailure.of(rule.field(), rule.message()));
                }
            }
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.completedFuture(List.copyOf(failures));
    }

    /**
     * Returns the number of rules.
     *
     * @return the rule count
     */
    public int size() {
        return rules.size();
    }

    private record Rule<R>(String field, Predicate<? super R> predicate, String message) {
    }

    /**
     * Builder for {@link RuleValidator}. Not thread-safe.
     *
     * @param <R> the request type
     */
    public static final class Builder<R> {

        private final List<Rule<R>> rules = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a rule that passes when the predicate returns true.
         *
         * @param field the field path reported on failure
         * @param predicate the condition that must hold
         * @param message the failure message
         * @return this
         * @throws IllegalArgumentException if any argument is null or message is blank
         */
        public Builder<R> rule(String field, Predicate<? super R> predicate, String message) {
            if (field == null) {
                throw new IllegalArgumentException("field cannot be null");
            }
            if (predicate == null) {
                throw new IllegalArgumentException("predicate cannot be null");
            }
            if (message == null || message.isBlank()) {
                throw new IllegalArgumentException("message cannot be null or blank");
            }
            rules.add(new Rule<>(field, predicate, message));
            return this;
        }

        /**
         * Adds a rule that fails when the accessed value is null.
         *
         * @param field the field path reported on failure
         * @param accessor reads the value from the request
         * @param message the failure message
         * @return this
         */
        public Builder<R> notNull(String field, Function<? super R, ?> accessor, String message) {
            if (accessor == null) {
                throw new IllegalArgumentException("accessor cannot be null");
            }
            return rule(field, request -> accessor.apply(request) != null, message);
        }

        /**
         * Adds a rule that fails when the accessed string is null or blank.
         *
         * @param field the field path reported on failure
         * @param accessor reads the value from the request
         * @param message the failure message
         * @return this
         */
        public Builder<R> notBlank(String field, Function<? super R, String> accessor, String message) {
            if (accessor == null) {
                throw new IllegalArgumentException("accessor cannot be null");
            }
            return rule(field, request -> {
                String value = accessor.apply(request);
                return value != null && !value.isBlank();
            }, message);
        }

        /**
         * Builds an immutable validator.
         *
         * @return a new RuleValidator
         */
        public RuleValidator<R> build() {
            return new RuleValidator<>(rules);
        }
    }
}
