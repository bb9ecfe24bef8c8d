/**
 * Spring configuration: executors, typed properties and component wiring.
 */
package com.phillippitts.genesis.config;
