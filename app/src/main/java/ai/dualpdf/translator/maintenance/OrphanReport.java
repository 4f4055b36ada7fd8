package ai.dualpdf.translator.maintenance;

/**
 * Totals of a pass that gives unpaired documents their first metadata marker.
 */
public record OrphanReport(int scanned, int candidates, int stamped, int skipped, int failed) {
}
