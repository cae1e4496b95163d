/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration classes:
 * <ul>
 *   <li>{@link com.phillippitts.huevoice.config.PipelineConfig} - long-lived pipeline collaborators</li>
 *   <li>{@link com.phillippitts.huevoice.config.ThreadPoolConfig} - recognition and feedback executors</li>
 *   <li>{@link com.phillippitts.huevoice.config.HttpClientConfig} - REST clients for the bridge and
 *       the speech service</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.logging} - MDC filter for HTTP requests</li>
 * </ul>
 */
package com.phillippitts.huevoice.config;
