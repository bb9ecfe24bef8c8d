/**
 * Plugin and shared-resource wiring.
 */
package com.phillippitts.genesis.config.plugin;
