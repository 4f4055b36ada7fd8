package ai.dualpdf.translator.metadata;

public enum EmbedResult {
    EMBEDDED("embedded"),
    ALREADY_EXISTS("already_exists");

    private final String reason;

    EmbedResult(String reason) {
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
