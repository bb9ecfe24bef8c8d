/**
 * Immutable value types shared across the event bridge and the dialogue pipeline.
 */
package com.phillippitts.genesis.domain;
