/**
 * Action planning: choose the reply source and motion for a turn, then drive speech and motion.
 */
package com.phillippitts.genesis.service.planner;
