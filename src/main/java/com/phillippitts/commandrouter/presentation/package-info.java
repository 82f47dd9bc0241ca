/**
 * Presentation layer: the stateless HTTP API and its exception mapping.
 *
 * <p>The realtime WebSocket channel lives in {@code service.channel}; both surfaces delegate to
 * {@link com.phillippitts.commandrouter.service.command.CommandService}.
 */
package com.phillippitts.commandrouter.presentation;
