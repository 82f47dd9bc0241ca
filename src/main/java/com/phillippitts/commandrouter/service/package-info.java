/**
 * Service layer: classification, entity resolution, workflow execution and the realtime channel.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.classifier} - pattern tier and model fallback tier</li>
 *   <li>{@code service.resolver} - alias directories and tie-break policies</li>
 *   <li>{@code service.workflow} - single step and pipeline execution with per-request traces</li>
 *   <li>{@code service.executor} - action executors and their registry</li>
 *   <li>{@code service.command} - entry point shared by HTTP and WebSocket</li>
 *   <li>{@code service.channel} - WebSocket sessions, ordering lanes and heartbeats</li>
 *   <li>{@code service.health}, {@code service.metrics}, {@code service.events} - operational concerns</li>
 * </ul>
 */
package com.phillippitts.commandrouter.service;
