/**
 * REST error mapping.
 */
package com.phillippitts.genesis.presentation.exception;
