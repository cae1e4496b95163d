/**
 * Immutable domain types flowing through the voice pipeline: audio clips, transcripts,
 * commands, light snapshots and timers. {@link com.phillippitts.huevoice.domain.LightHandle}
 * is the one live abstraction here; everything else is a value.
 */
package com.phillippitts.huevoice.domain;
