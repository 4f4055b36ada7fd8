package ai.dualpdf.translator.maintenance;

/**
 * Totals of a backfill pass over translated/original pairs.
 */
public record PairReport(int pairs, int updated, int unchanged, int failed, int staleTemporariesRemoved) {
}
