/**
 * REST API controllers for the collaborator layer.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /api/enhance} - run one enhancement on a local source file</li>
 *   <li>{@code GET /api/status} - uptime, processed count, active users</li>
 *   <li>{@code GET /api/activities} - last 50 activities, newest first</li>
 * </ul>
 *
 * @see com.phillippitts.enhancer.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.enhancer.presentation.controller;
