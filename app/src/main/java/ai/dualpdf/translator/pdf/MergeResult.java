package ai.dualpdf.translator.pdf;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

public record MergeResult(Path output, int pages, List<PageSize> pageSizes) {

    public MergeResult {
        Objects.requireNonNull(output, "output");
        pageSizes = List.copyOf(Objects.requireNonNull(pageSizes, "pageSizes"));
    }
}
