/**
 * Audio format constants and level measurement shared by wake detection and command capture.
 */
package com.phillippitts.huevoice.service.audio;
