/**
 * In-memory validation adapter.
 *
 * <ul>
 *   <li>{@link com.ryuqq.mediator.adapter.inmemory.validation.RuleValidator} - Predicate-rule implementation of the Validator SPI</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Mediator Team
 */
package com.ryuqq.mediator.adapter.inmemory.validation;
