/**
 * Sealed message variants exchanged over {@link com.phillippitts.huevoice.service.pipeline.EventChannel}s.
 */
package com.phillippitts.huevoice.service.pipeline.event;
