/**
 * Logging infrastructure: MDC for HTTP requests.
 *
 * <p>MDC keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request, from {@code X-Request-ID} or generated</li>
 *   <li>{@code commandId} - set by the dispatcher while it executes one spoken command</li>
 * </ul>
 */
package com.phillippitts.huevoice.config.logging;
