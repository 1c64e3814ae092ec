/**
 * Test doubles for the fleet SPIs.
 *
 * <ul>
 *   <li>{@link com.ryuqq.fleet.testkit.fake.InMemoryProcessLifecycleManager}: bookkeeping-only workers</li>
 *   <li>{@link com.ryuqq.fleet.testkit.fake.ScriptedRoutingOracle}: scripted or straight-line routes</li>
 *   <li>{@link com.ryuqq.fleet.testkit.fake.RecordingCoordinationObserver}: callbacks as text lines</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.testkit.fake;
