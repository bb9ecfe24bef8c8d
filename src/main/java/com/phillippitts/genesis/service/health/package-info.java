/**
 * Actuator health indicators.
 */
package com.phillippitts.genesis.service.health;
