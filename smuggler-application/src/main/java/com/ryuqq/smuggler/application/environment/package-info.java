/**
 * Applies decoded configuration to an injected {@link com.ryuqq.smuggler.core.spi.Environment}.
 *
 * @since 1.0.0
 * @author Smuggler Team
 */
package com.ryuqq.smuggler.application.environment;
