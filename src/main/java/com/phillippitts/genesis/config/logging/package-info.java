/**
 * MDC population for HTTP requests and MDC propagation across executors.
 */
package com.phillippitts.genesis.config.logging;
