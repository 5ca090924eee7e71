/**
 * In-memory repository adapter.
 *
 * <ul>
 *   <li>{@link com.ryuqq.mediator.adapter.inmemory.repository.InMemoryRepository} - Async, cancellation-aware map-backed storage</li>
 *   <li>{@link com.ryuqq.mediator.adapter.inmemory.repository.Page} - One page of results plus total count</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Mediator Team
 */
package com.ryuqq.mediator.adapter.inmemory.repository;
