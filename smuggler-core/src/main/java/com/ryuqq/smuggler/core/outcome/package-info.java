/**
 * Per-entry decode outcomes.
 *
 * <ul>
 *   <li>{@link com.ryuqq.smuggler.core.outcome.DecodedEntry} - the entry decoded and can be merged</li>
 *   <li>{@link com.ryuqq.smuggler.core.outcome.InvalidEntry} - the entry was excluded with a reason</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Smuggler Team
 */
package com.ryuqq.smuggler.core.outcome;
