/**
 * Core domain model package: the ticket and the arguments and results of registry operations.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.model.TicketId} - Ticket unique identifier</li>
 *   <li>{@link com.ryuqq.registry.core.model.Ticket} - Registered entry (id, position, value, valueIsPosition)</li>
 * </ul>
 *
 * <h2>Operation Arguments</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.model.Registration} - Partial ticket passed to register</li>
 *   <li>{@link com.ryuqq.registry.core.model.TicketPatch} - Tri-state value change passed to upsert</li>
 *   <li>{@link com.ryuqq.registry.core.model.SeekDirection} - Scan direction of seek</li>
 * </ul>
 *
 * <h2>Operation Results</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.model.CatalogMatch} - Single or multi-valued result of browse</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All types are immutable; reindexing replaces snapshots</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.model;
