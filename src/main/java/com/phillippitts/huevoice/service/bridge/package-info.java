/**
 * Light bridge boundary: the {@link com.phillippitts.huevoice.service.bridge.DeviceBridge} contract,
 * its Hue REST implementation, pairing and credential persistence, and the light cache.
 */
package com.phillippitts.huevoice.service.bridge;
