/**
 * Intent classification: the resolver contract, a keyword default and the shared intent names.
 */
package com.phillippitts.genesis.service.intent;
