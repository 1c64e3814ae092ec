/**
 * Core value objects shared by every coordination component.
 *
 * <ul>
 *   <li>{@link com.ryuqq.fleet.core.model.OperationId} - fleet operation identifier</li>
 *   <li>{@link com.ryuqq.fleet.core.model.Location} - known location with coordinates and traits</li>
 *   <li>{@link com.ryuqq.fleet.core.model.ExtractionTarget} - extraction class to location trait mapping</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.core.model;
