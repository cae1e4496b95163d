/**
 * Small static helpers for logging and spoken durations.
 */
package com.phillippitts.huevoice.util;
