/**
 * Micrometer meters for the voice pipeline.
 */
package com.phillippitts.huevoice.service.metrics;
