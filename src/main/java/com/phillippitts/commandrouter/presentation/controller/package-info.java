/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /api/commands} - stateless single command, answered with the same result
 *       shape the WebSocket channel sends</li>
 *   <li>{@code GET /api/intents} - intents with a registered executor</li>
 * </ul>
 *
 * @see com.phillippitts.commandrouter.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.commandrouter.presentation.controller;
