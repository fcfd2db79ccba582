/**
 * In-memory Registry adapter implementation package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.registry.adapter.inmemory.registry.InMemoryRegistry}:
 *       Single-writer implementation of {@link com.ryuqq.registry.core.spi.Registry}</li>
 *   <li>{@link com.ryuqq.registry.adapter.inmemory.registry.SynchronizedRegistry}:
 *       Monitor-based decorator for sharing a registry across threads</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Lazy Reindex:</strong> removals lower a dirty watermark; ordered reads settle it</li>
 *   <li><strong>Deferred Invalidation:</strong> batches collapse cache invalidation to one per batch</li>
 *   <li><strong>Ordered Emission:</strong> events fire after bookkeeping, queued in order during a batch</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Registry&lt;String&gt; registry = new InMemoryRegistry&lt;&gt;(RegistryConfig.defaults().withEventsEnabled(true));
 *
 * // Use in Contract Tests
 * class InMemoryRegistrationContractTest extends AbstractRegistrationContractTest {
 *     {@literal @}Override
 *     protected Registry&lt;String&gt; createRegistry(RegistryConfig config) {
 *         return new InMemoryRegistry&lt;&gt;(config);
 *     }
 * }
 * </pre>
 *
 * @see com.ryuqq.registry.core.spi.Registry
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.adapter.inmemory.registry;
