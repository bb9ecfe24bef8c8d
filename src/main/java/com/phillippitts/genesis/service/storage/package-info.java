/**
 * JSON-file key/value storage.
 */
package com.phillippitts.genesis.service.storage;
