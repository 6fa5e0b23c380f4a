/**
 * Device transport: {@link com.phillippitts.kioskwatch.service.device.DeviceLink} and its
 * {@code adb} implementation.
 *
 * <p>Every failure inside the transport is logged here and surfaces to callers as
 * {@code false} or an empty {@code Optional}; {@code DeviceCommandException} never escapes.
 */
package com.phillippitts.kioskwatch.service.device;
