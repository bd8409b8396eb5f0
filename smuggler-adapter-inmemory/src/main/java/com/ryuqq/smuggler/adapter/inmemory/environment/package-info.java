/**
 * In-memory {@link com.ryuqq.smuggler.core.spi.Environment} adapter.
 *
 * <p>Thread-safe, process-local storage of per-app options for tests and reference use.
 * Not suitable for production: data is lost on restart.</p>
 *
 * @see com.ryuqq.smuggler.core.spi.Environment
 * @see com.ryuqq.smuggler.adapter.inmemory.environment.InMemoryEnvironment
 * @author Smuggler Team
 * @since 1.0.0
 */
package com.ryuqq.smuggler.adapter.inmemory.environment;
