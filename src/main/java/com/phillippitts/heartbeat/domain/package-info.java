/**
 * Domain models for service heartbeats.
 *
 * <p>All types here are immutable values. The registry keeps its own mutable per-service state
 * and only ever hands out {@link com.phillippitts.heartbeat.domain.ServiceSnapshot} copies.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.heartbeat.domain.HeartbeatStatus} - closed set of health states</li>
 *   <li>{@link com.phillippitts.heartbeat.domain.HeartbeatEvent} - one entry of a service's history</li>
 *   <li>{@link com.phillippitts.heartbeat.domain.ServiceSnapshot} - immutable copy of a service record</li>
 *   <li>{@link com.phillippitts.heartbeat.domain.RegistrySummary} - counts per status</li>
 * </ul>
 */
package com.phillippitts.heartbeat.domain;
