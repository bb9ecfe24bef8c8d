/**
 * Hardware link wiring.
 */
package com.phillippitts.genesis.config.hardware;
