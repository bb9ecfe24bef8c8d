/**
 * Dialogue pipeline wiring.
 */
package com.phillippitts.genesis.config.dialogue;
