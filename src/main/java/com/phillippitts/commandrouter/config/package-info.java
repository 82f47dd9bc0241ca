/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.commandrouter.config.ThreadPoolConfig} - command, classifier and
 *       action executor pools with log context propagation</li>
 *   <li>{@link com.phillippitts.commandrouter.config.WebSocketConfig} - registers the realtime
 *       command channel endpoint</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - validated {@code router.*} configuration properties</li>
 *   <li>{@code config.logging} - Log4j2 thread context keys and the HTTP request filter</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.commandrouter.config;
