/**
 * Logging infrastructure built on the Log4j2 {@code ThreadContext}.
 *
 * <p>{@link com.phillippitts.commandrouter.config.logging.MdcFilter} tags every HTTP request with a
 * {@code requestId}; {@link com.phillippitts.commandrouter.config.logging.LogContext} holds the keys
 * shared by the channel, the command service and the pool task decorator.
 */
package com.phillippitts.commandrouter.config.logging;
