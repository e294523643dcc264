/**
 * Receiver Core
 * =============================================================================
 *
 * <p>The dispatch engine that turns raw feed events into typed
 * {@link com.questrail.tradefeed.api.Message}s and fans them out to listeners.</p>
 *
 * <pre>
 *   reader (name, args...)
 *        → Receiver.accept / per-type entry point / error adapter
 *            → Receiver.dispatch(type, fields)
 *                → MessageType.newMessage
 *                    → MessageListener.onMessage (each, in order)
 * </pre>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>No socket I/O, framing or reconnect logic lives here</li>
 *   <li>The message catalogue is supplied, never discovered</li>
 *   <li>Listener failures are contained; they never reach the reader thread</li>
 * </ul>
 */
package com.questrail.tradefeed.core;
