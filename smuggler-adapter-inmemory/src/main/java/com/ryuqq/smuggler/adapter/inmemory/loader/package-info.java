/**
 * In-memory {@link com.ryuqq.smuggler.core.spi.ConfigLoader} adapter backed by pre-registered trees.
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
package com.ryuqq.smuggler.adapter.inmemory.loader;
