/**
 * Application lifecycle of the robot brain.
 */
package com.phillippitts.genesis.service.runtime;
