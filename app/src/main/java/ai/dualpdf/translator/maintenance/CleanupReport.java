package ai.dualpdf.translator.maintenance;

/**
 * Totals of a cleanup pass.
 */
public record CleanupReport(int deletedFiles, long bytesFreed, int failures) {
}
