/**
 * Reusable contract suites for {@link com.ryuqq.registry.core.spi.Registry} implementations.
 *
 * <p>Each suite is abstract; an implementation module extends it and supplies
 * {@link com.ryuqq.registry.testkit.contract.AbstractRegistryContractTest#createRegistry}.</p>
 *
 * <h2>Suites</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.testkit.contract.RegistrationContractTest} - register, upsert, unregister, clear</li>
 *   <li>{@link com.ryuqq.registry.testkit.contract.CatalogContractTest} - reverse lookup by value</li>
 *   <li>{@link com.ryuqq.registry.testkit.contract.ReindexContractTest} - position contiguity after removals</li>
 *   <li>{@link com.ryuqq.registry.testkit.contract.EventContractTest} - event channel</li>
 *   <li>{@link com.ryuqq.registry.testkit.contract.BatchContractTest} - batched mutations</li>
 *   <li>{@link com.ryuqq.registry.testkit.contract.SeekContractTest} - directional scan</li>
 *   <li>{@link com.ryuqq.registry.testkit.contract.DerivedViewContractTest} - cached views</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.testkit.contract;
