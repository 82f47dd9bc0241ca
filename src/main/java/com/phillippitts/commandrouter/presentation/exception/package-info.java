/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@code IllegalArgumentException}, validation and unreadable bodies → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.commandrouter.exception.CommandTimeoutException} → 504 Gateway Timeout</li>
 *   <li>{@code RejectedExecutionException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "ValidationError",
 *   "message": "Invalid command request",
 *   "details": "command must not be blank",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.commandrouter.presentation.exception;
