/**
 * Codecs between model values and their flat string form.
 *
 * <ul>
 *   <li>{@link com.ryuqq.smuggler.core.codec.PathCodec} - namespace path to and from an encoded key</li>
 *   <li>{@link com.ryuqq.smuggler.core.codec.ValueCodec} - literal to and from its textual representation</li>
 * </ul>
 *
 * <p>Value decoding uses a recursive-descent parser over a closed literal grammar.
 * Nothing in this package evaluates input.</p>
 *
 * @since 1.0.0
 * @author Smuggler Team
 */
package com.ryuqq.smuggler.core.codec;
