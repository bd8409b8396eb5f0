/**
 * Service Provider Interface (SPI) package.
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.smuggler.core.spi.ConfigLoader} - loads a configuration tree from a named source</li>
 *   <li>{@link com.ryuqq.smuggler.core.spi.Environment} - reads and writes live per-app configuration</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g., smuggler-adapter-inmemory) provide concrete implementations.
 * The core transform never calls an {@code Environment} itself.</p>
 *
 * @since 1.0.0
 * @author Smuggler Team
 */
package com.ryuqq.smuggler.core.spi;
