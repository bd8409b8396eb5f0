/**
 * Contract test infrastructure for the transform and for SPI implementations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.smuggler.testkit.contract.AbstractContractTest} - base for transform contracts</li>
 *   <li>{@link com.ryuqq.smuggler.testkit.contract.AbstractEnvironmentContractTest} - contracts every
 *       {@link com.ryuqq.smuggler.core.spi.Environment} adapter must pass</li>
 *   <li>{@link com.ryuqq.smuggler.testkit.contract.SmugglerFixtures} - tree builders</li>
 * </ul>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
package com.ryuqq.smuggler.testkit.contract;
