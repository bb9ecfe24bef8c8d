/**
 * Clock-driven time and date phrases.
 */
package com.phillippitts.genesis.service.time;
