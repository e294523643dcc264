/**
 * Diagnostic output of the receiver: listener faults, rejected field mappings
 * and dropped dispatches. The SLF4J sink is the production default.
 */
package com.questrail.tradefeed.observability;
