/**
 * Exception hierarchy rooted at {@link com.phillippitts.genesis.exception.GenesisException}.
 */
package com.phillippitts.genesis.exception;
