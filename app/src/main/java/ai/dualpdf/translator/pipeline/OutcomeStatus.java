package ai.dualpdf.translator.pipeline;

/**
 * Values of the {@code status} column of the outcome log.
 */
public enum OutcomeStatus {
    OK("ok"),
    OK_OCR("ok_ocr"),
    SKIPPED("skipped"),
    FAILED("failed"),
    WOULD_TRANSLATE("would_translate"),
    METADATA_FAILED("metadata_failed"),
    ATTACHMENT_FAILED("attachment_failed");

    private final String value;

    OutcomeStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
