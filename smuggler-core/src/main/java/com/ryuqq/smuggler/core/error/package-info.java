/**
 * Error kinds and the unchecked exception hierarchy rooted at
 * {@link com.ryuqq.smuggler.core.error.SmugglerException}.
 *
 * <p>{@code BAD_KEY} and {@code BAD_VALUE} are entry-scoped: during decoding they are
 * collected as {@link com.ryuqq.smuggler.core.outcome.InvalidEntry} instead of being thrown.</p>
 *
 * @since 1.0.0
 * @author Smuggler Team
 */
package com.ryuqq.smuggler.core.error;
