/**
 * Configuration tree model: identifiers, literal values, option lists and the tree itself.
 *
 * <h2>Identifiers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.smuggler.core.model.Symbol} - lowercase atom such as {@code :my_app}</li>
 *   <li>{@link com.ryuqq.smuggler.core.model.QualifiedName} - dotted module name such as {@code MyApp.Endpoint}</li>
 * </ul>
 *
 * <h2>Literals</h2>
 * <p>{@link com.ryuqq.smuggler.core.model.Literal} is a sealed hierarchy of the values a configuration
 * leaf may hold. {@link com.ryuqq.smuggler.core.model.OptionList} is both a literal and the container
 * of an app's options; only a non-empty one with unique keys is treated as a nested group.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> every type is immutable and safe to share across threads</li>
 *   <li><strong>Validation:</strong> constructors reject malformed input with {@link java.lang.IllegalArgumentException}</li>
 *   <li><strong>Pure Java:</strong> no external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Smuggler Team
 */
package com.ryuqq.smuggler.core.model;
