/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.commandrouter.exception.CommandRouterException} - Base exception</li>
 *   <li>{@link com.phillippitts.commandrouter.exception.ClassificationException} - fallback model
 *       output rejected or call failed</li>
 *   <li>{@link com.phillippitts.commandrouter.exception.EntityNotFoundException} - name not in a
 *       candidate directory</li>
 *   <li>{@link com.phillippitts.commandrouter.exception.ExecutorException} - action executor
 *       failed or timed out</li>
 *   <li>{@link com.phillippitts.commandrouter.exception.WorkflowAbortException} - pipeline
 *       stopped at a failed producer</li>
 *   <li>{@link com.phillippitts.commandrouter.exception.ChannelException} - realtime delivery
 *       failed</li>
 *   <li>{@link com.phillippitts.commandrouter.exception.CommandTimeoutException} - stateless
 *       call exceeded its budget</li>
 * </ul>
 *
 * <p>Inside the workflow these are normalized into failure results; only
 * {@code CommandTimeoutException} and request validation errors reach the HTTP boundary.
 *
 * @see com.phillippitts.commandrouter.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.commandrouter.exception;
