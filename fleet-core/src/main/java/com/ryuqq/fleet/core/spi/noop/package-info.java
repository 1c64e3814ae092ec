/**
 * No-op SPI implementations used as defaults.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.core.spi.noop;
