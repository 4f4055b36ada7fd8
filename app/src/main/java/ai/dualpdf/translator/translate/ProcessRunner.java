package ai.dualpdf.translator.translate;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command to completion or until the timeout expires.
 */
@FunctionalInterface
public interface ProcessRunner {

    ProcessResult run(List<String> command, Path workingDirectory, Duration timeout)
            throws IOException, InterruptedException;
}
