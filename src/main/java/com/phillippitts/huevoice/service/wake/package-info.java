/**
 * Local wake-word detection. Audio never leaves the machine until the wake word opens a command window.
 */
package com.phillippitts.huevoice.service.wake;
