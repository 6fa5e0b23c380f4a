/**
 * Maps application exceptions to HTTP responses.
 */
package com.phillippitts.kioskwatch.presentation.exception;
