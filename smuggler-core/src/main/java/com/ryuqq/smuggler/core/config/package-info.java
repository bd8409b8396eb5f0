/**
 * Immutable runtime settings.
 *
 * @since 1.0.0
 * @author Smuggler Team
 */
package com.ryuqq.smuggler.core.config;
