/**
 * REST adapter: thin controllers over the registry and the monitor, request bodies and
 * the mapping of registry exceptions to HTTP errors.
 */
package com.phillippitts.heartbeat.presentation;
