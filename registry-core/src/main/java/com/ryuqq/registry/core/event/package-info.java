/**
 * Typed registry events.
 *
 * <p>{@link com.ryuqq.registry.core.event.EventKind} is the closed set of structural events;
 * {@link com.ryuqq.registry.core.event.CustomEvent} carries application-defined names.
 * Every event is a {@link com.ryuqq.registry.core.event.RegistryEvent} delivered to
 * {@link com.ryuqq.registry.core.event.RegistryListener}s synchronously.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.event;
