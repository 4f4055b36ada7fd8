package ai.dualpdf.translator.metadata;

import ai.dualpdf.translator.writer.CommitResult;
import java.util.Objects;
import java.util.Optional;

/**
 * What a stamping pass changed. {@code commit} is empty when the document was left untouched or written to a
 * caller-chosen target.
 */
public record StampResult(EmbedResult metadata,
                          boolean backReferenceAdded,
                          Optional<String> attachmentFailure,
                          Optional<CommitResult> commit) {

    public StampResult {
        Objects.requireNonNull(metadata, "metadata");
        attachmentFailure = attachmentFailure == null ? Optional.empty() : attachmentFailure;
        commit = commit == null ? Optional.empty() : commit;
    }

    public boolean changed() {
        return metadata == EmbedResult.EMBEDDED || backReferenceAdded;
    }
}
