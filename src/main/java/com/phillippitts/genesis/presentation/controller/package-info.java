/**
 * REST endpoints for operators.
 */
package com.phillippitts.genesis.presentation.controller;
