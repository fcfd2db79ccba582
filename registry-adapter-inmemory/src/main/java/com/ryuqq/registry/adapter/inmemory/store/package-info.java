/**
 * Primary store of the in-memory registry.
 *
 * <p>{@link com.ryuqq.registry.adapter.inmemory.store.TicketArena} keeps tickets in insertion
 * order, addressed by a dense integer handle, and is the single source of truth for existence
 * and content.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.adapter.inmemory.store;
