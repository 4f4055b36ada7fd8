package ai.dualpdf.translator.translate;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}. Output of the child is discarded.
 */
public class SystemProcessRunner implements ProcessRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemProcessRunner.class);

    @Override
    public ProcessResult run(List<String> command, Path workingDirectory, Duration timeout)
            throws InterruptedException {
        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(workingDirectory.toFile())
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            return ProcessResult.notStarted(ex.getMessage());
        }
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Translator exceeded {} s, terminating pid {}", timeout.toSeconds(), process.pid());
                process.destroyForcibly();
                process.waitFor(10, TimeUnit.SECONDS);
                return ProcessResult.timedOut();
            }
            return ProcessResult.exited(process.exitValue());
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            throw ex;
        }
    }
}
