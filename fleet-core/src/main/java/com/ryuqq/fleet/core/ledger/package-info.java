/**
 * Per-resource cargo ledger.
 *
 * <p>{@link com.ryuqq.fleet.core.ledger.ResourceLedger} tracks inventory, capacity and the two kinds
 * of reservation (space for incoming cargo, units promised to outgoing transfers) of one shared buffer.
 * Every method takes the ledger's own monitor; coordinators that hold a registry lock always acquire
 * it before touching a ledger, never the other way round.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.core.ledger;
