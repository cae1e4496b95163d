/**
 * In-memory timers that re-submit a command after a spoken delay.
 */
package com.phillippitts.huevoice.service.timer;
