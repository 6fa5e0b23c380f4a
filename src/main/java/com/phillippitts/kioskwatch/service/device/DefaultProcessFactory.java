package com.phillippitts.kioskwatch.service.device;

import java.io.IOException;
import java.util.List;

/**
 * {@link ProcessFactory} backed by {@link ProcessBuilder}. stdout and stderr stay separate.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(false);
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        return pb.start();
    }
}
