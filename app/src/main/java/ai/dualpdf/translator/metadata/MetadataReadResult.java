package ai.dualpdf.translator.metadata;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Outcome of looking up the metadata attachment of a document.
 */
public record MetadataReadResult(Outcome outcome, String detail, OptionalDouble gapPt) {

    public enum Outcome {
        NO_METADATA_FOUND("no_metadata_found"),
        METADATA_EMPTY("metadata_empty"),
        METADATA_PARSE_ERROR("metadata_parse_error"),
        TRANSLATED("translated"),
        UNTRANSLATED("untranslated"),
        UNKNOWN_STATUS("unknown_status");

        private final String tag;

        Outcome(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    public MetadataReadResult {
        Objects.requireNonNull(outcome, "outcome");
        detail = detail == null ? "" : detail;
        gapPt = gapPt == null ? OptionalDouble.empty() : gapPt;
    }

    static MetadataReadResult of(Outcome outcome) {
        return new MetadataReadResult(outcome, "", OptionalDouble.empty());
    }

    public boolean isTranslated() {
        return outcome == Outcome.TRANSLATED;
    }

    /**
     * Machine-readable reason, e.g. {@code unknown_status:pending}.
     */
    public String reason() {
        if (outcome == Outcome.UNKNOWN_STATUS) {
            return outcome.tag() + ":" + detail;
        }
        return outcome.tag();
    }
}
