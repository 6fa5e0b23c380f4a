/**
 * REST controllers exposing the monitor's status, report and recovery trigger.
 */
package com.phillippitts.kioskwatch.presentation.controller;
