/**
 * Conversation transcript.
 */
package com.phillippitts.genesis.service.log;
