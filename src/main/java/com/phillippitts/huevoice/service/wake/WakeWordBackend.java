package com.phillippitts.huevoice.service.wake;

/**
 * Loads keyword detectors.
 */
public interface WakeWordBackend {

    /**
     * @param keyword     keyword to listen for
     * @param sensitivity 0.0 (strict) to 1.0 (permissive)
     * @throws com.phillippitts.huevoice.exception.WakeWordUnavailableException if the keyword cannot be loaded
     */
    WakeWordHandle create(String keyword, double sensitivity);
}
