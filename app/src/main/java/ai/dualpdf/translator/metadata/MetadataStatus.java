package ai.dualpdf.translator.metadata;

/**
 * Translation state recorded in a document's embedded metadata.
 */
public enum MetadataStatus {
    UNTRANSLATED("untranslated"),
    TRANSLATED("translated");

    private final String wireValue;

    MetadataStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
