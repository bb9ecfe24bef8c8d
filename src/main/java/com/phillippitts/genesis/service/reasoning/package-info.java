/**
 * Remote language model access and persona styling.
 */
package com.phillippitts.genesis.service.reasoning;
