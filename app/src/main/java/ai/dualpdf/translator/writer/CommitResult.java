package ai.dualpdf.translator.writer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a committed file ended up.
 */
public record CommitResult(Status status, Path location) {

    public enum Status {
        REPLACED,
        SIDECAR,
        FAILED
    }

    public CommitResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(location, "location");
    }

    public static CommitResult replaced(Path location) {
        return new CommitResult(Status.REPLACED, location);
    }

    public static CommitResult sidecar(Path location) {
        return new CommitResult(Status.SIDECAR, location);
    }

    public static CommitResult failed(Path location) {
        return new CommitResult(Status.FAILED, location);
    }

    public boolean committed() {
        return status != Status.FAILED;
    }
}
