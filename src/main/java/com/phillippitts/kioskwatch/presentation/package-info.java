/**
 * Presentation layer: the REST surface over the monitor.
 */
package com.phillippitts.kioskwatch.presentation;
