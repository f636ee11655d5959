/**
 * Heartbeat monitor exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.heartbeat.exception.HeartbeatException} - Base exception</li>
 *   <li>{@link com.phillippitts.heartbeat.exception.ServiceNotFoundException} - unknown service id
 *       (caller-facing, HTTP 404)</li>
 *   <li>{@link com.phillippitts.heartbeat.exception.DuplicateServiceException} - explicit id already
 *       registered (caller-facing, HTTP 409)</li>
 *   <li>{@link com.phillippitts.heartbeat.exception.InvalidStatusException} - status outside the
 *       closed status set (caller-facing, HTTP 400)</li>
 *   <li>{@link com.phillippitts.heartbeat.exception.StorageUnavailableException} - storage
 *       collaborator failure, contained by the registry</li>
 *   <li>{@link com.phillippitts.heartbeat.exception.NotifierException} - notifier failure,
 *       contained by the dispatcher</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support chaining via {@code cause}.
 *
 * @see com.phillippitts.heartbeat.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.heartbeat.exception;
