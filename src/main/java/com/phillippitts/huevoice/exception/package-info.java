/**
 * Application-specific exception hierarchy.
 *
 * <p>Every exception extends {@link com.phillippitts.huevoice.exception.HueVoiceException}:
 * <ul>
 *   <li>{@link com.phillippitts.huevoice.exception.RecognitionException} - speech service failed
 *       or did not understand the clip</li>
 *   <li>{@link com.phillippitts.huevoice.exception.DeviceBridgeException} - light bridge fetch or
 *       mutation failed; the dispatcher invalidates its cache and moves on</li>
 *   <li>{@link com.phillippitts.huevoice.exception.WakeWordUnavailableException} - no wake word
 *       could be loaded</li>
 *   <li>{@link com.phillippitts.huevoice.exception.BridgePairingException} - no bridge credentials</li>
 *   <li>{@link com.phillippitts.huevoice.exception.MicrophoneUnavailableException} - no capture
 *       line could be opened</li>
 *   <li>{@link com.phillippitts.huevoice.exception.CommandRejectedException} - command channel is
 *       full</li>
 * </ul>
 *
 * @see com.phillippitts.huevoice.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.huevoice.exception;
