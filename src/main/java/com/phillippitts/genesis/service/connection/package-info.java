/**
 * Hardware link session lifecycle, command gating and the reconnect heartbeat.
 */
package com.phillippitts.genesis.service.connection;
