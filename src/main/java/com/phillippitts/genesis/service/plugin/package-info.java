/**
 * Plugin contract, explicit registration and shared-resource injection.
 */
package com.phillippitts.genesis.service.plugin;
