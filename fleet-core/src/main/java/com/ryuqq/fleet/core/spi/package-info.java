/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Narrow interfaces to the collaborators that stay outside the engine.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fleet.core.spi.RoutingOracle} - fuel-aware route planning</li>
 *   <li>{@link com.ryuqq.fleet.core.spi.ProcessLifecycleManager} - start/stop worker processes</li>
 *   <li>{@link com.ryuqq.fleet.core.spi.CoordinationObserver} - observation of coordination events</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>The remote API client, the pathfinder and the process supervisor provide the concrete
 * implementations. The testkit module ships scripted fakes of each.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.core.spi;
