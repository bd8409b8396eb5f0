/**
 * Tree flattening, deep merging and per-entry decoding.
 *
 * @since 1.0.0
 * @author Smuggler Team
 */
package com.ryuqq.smuggler.core.transform;
