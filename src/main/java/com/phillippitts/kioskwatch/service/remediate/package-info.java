/**
 * Error-kind to device-script mapping with per-kind cooldown and bounded outcome history.
 */
package com.phillippitts.kioskwatch.service.remediate;
