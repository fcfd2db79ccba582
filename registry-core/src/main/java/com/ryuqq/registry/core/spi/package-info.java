/**
 * Service Provider Interface (SPI) package.
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.spi.Registry} - Indexed registry contract</li>
 *   <li>{@link com.ryuqq.registry.core.spi.TicketIdGenerator} - Id strategy for tickets registered without an id</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g., registry-adapter-inmemory) provide concrete implementations and
 * verify them against the contract suites of registry-testkit.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.spi;
