/**
 * Presentation layer: a small local REST surface for status and text commands.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - status and command endpoints</li>
 *   <li>{@code presentation.exception} - maps domain exceptions to HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters. Commands go onto the same channel the recognizer feeds.
 */
package com.phillippitts.huevoice.presentation;
