package ai.dualpdf.translator.translate;

/**
 * How a child process ended. {@code exitCode} is meaningful only for {@link Status#EXITED}.
 */
public record ProcessResult(Status status, int exitCode, String detail) {

    public enum Status {
        EXITED,
        TIMED_OUT,
        NOT_STARTED
    }

    public ProcessResult {
        detail = detail == null ? "" : detail;
    }

    public static ProcessResult exited(int exitCode) {
        return new ProcessResult(Status.EXITED, exitCode, "");
    }

    public static ProcessResult timedOut() {
        return new ProcessResult(Status.TIMED_OUT, -1, "");
    }

    public static ProcessResult notStarted(String detail) {
        return new ProcessResult(Status.NOT_STARTED, -1, detail);
    }

    public boolean succeeded() {
        return status == Status.EXITED && exitCode == 0;
    }
}
