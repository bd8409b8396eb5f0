/**
 * Encode and decode use cases.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.smuggler.application.smuggler.Smuggler} - entry point interface</li>
 *   <li>{@link com.ryuqq.smuggler.application.smuggler.ConfigSmuggler} - default implementation wired from a
 *       {@link com.ryuqq.smuggler.core.config.SmugglerConfig}</li>
 *   <li>{@link com.ryuqq.smuggler.application.smuggler.DecodeOrchestrator} - sorted, isolated per-entry decode
 *       followed by a sequential deep-merge fold</li>
 *   <li>{@link com.ryuqq.smuggler.application.smuggler.StatementEncoder} - encodes a single
 *       {@code config :app, ...} statement</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Smuggler Team
 */
package com.ryuqq.smuggler.application.smuggler;
