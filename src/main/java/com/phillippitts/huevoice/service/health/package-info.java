/**
 * Actuator health contributions.
 */
package com.phillippitts.huevoice.service.health;
