/**
 * Auxiliary hash indices kept next to the primary store.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.registry.adapter.inmemory.index.PositionDirectory}:
 *       position → id</li>
 *   <li>{@link com.ryuqq.registry.adapter.inmemory.index.ValueCatalog}:
 *       resolved value → one or many ids</li>
 * </ul>
 *
 * <p>Both may be stale while a lazy reindex is pending.</p>
 *
 * @see com.ryuqq.registry.adapter.inmemory.reindex.LazyReindexer
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.adapter.inmemory.index;
