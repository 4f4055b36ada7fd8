package ai.dualpdf.translator.translate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Stands in for the external translator: each run follows the next scripted step and, when asked to produce
 * output, copies the input to the mono file name the real tool would write.
 */
public class FakeTranslator implements ProcessRunner {

    public enum Step {
        PRODUCE,
        EXIT_ZERO_WITHOUT_OUTPUT,
        EXIT_FAILURE,
        TIME_OUT,
        NOT_STARTED,
        THROW
    }

    private final String langOut;
    private final Deque<Step> steps = new ArrayDeque<>();
    private final List<List<String>> commands = new ArrayList<>();
    private boolean dropCsv;

    public FakeTranslator(String langOut, Step... script) {
        this.langOut = langOut;
        this.steps.addAll(List.of(script));
    }

    public FakeTranslator droppingCsv() {
        this.dropCsv = true;
        return this;
    }

    public List<List<String>> commands() {
        return commands;
    }

    @Override
    public ProcessResult run(List<String> command, Path workDir, Duration timeout) throws IOException {
        commands.add(List.copyOf(command));
        Step step = steps.isEmpty() ? Step.PRODUCE : steps.poll();
        if (dropCsv) {
            Files.writeString(workDir.resolve("glossary-" + commands.size() + ".csv"), "term,translation\n");
        }
        switch (step) {
            case PRODUCE -> {
                Path input = inputOf(command);
                String name = input.getFileName().toString();
                String stem = name.substring(0, name.lastIndexOf('.'));
                Path output = Path.of(command.get(command.indexOf("--output") + 1));
                Files.copy(input, output.resolve(stem + ".no_watermark." + langOut + ".mono.pdf"));
                return ProcessResult.exited(0);
            }
            case EXIT_ZERO_WITHOUT_OUTPUT -> {
                return ProcessResult.exited(0);
            }
            case EXIT_FAILURE -> {
                return ProcessResult.exited(1);
            }
            case TIME_OUT -> {
                return ProcessResult.timedOut();
            }
            case NOT_STARTED -> {
                return ProcessResult.notStarted("No such file or directory");
            }
            default -> throw new IllegalStateException("translator crashed");
        }
    }

    private static Path inputOf(List<String> command) {
        for (int i = 1; i < command.size(); i++) {
            String argument = command.get(i);
            if (argument.toLowerCase(Locale.ROOT).endsWith(".pdf") && !"--output".equals(command.get(i - 1))) {
                return Path.of(argument);
            }
        }
        throw new IllegalArgumentException("no input document in " + command);
    }
}
