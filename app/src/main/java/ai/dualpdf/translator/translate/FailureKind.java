package ai.dualpdf.translator.translate;

public enum FailureKind {
    EXIT_CODE,
    TIMEOUT,
    EXECUTABLE_NOT_FOUND,
    TEMP_FILE_IO,
    OUTPUT_NOT_FOUND,
    UNEXPECTED
}
