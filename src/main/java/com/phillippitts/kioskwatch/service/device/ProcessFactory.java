package com.phillippitts.kioskwatch.service.device;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so the adb transport can be tested without an
 * adb binary.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests return a fake {@link Process}
 * with controlled stdout, stderr and exit behavior.
 */
interface ProcessFactory {
    /**
     * Starts a new process.
     *
     * @param command full command line, with the executable as the first element
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command) throws IOException;
}
