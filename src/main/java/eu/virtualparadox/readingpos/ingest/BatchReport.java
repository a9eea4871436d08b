package eu.virtualparadox.readingpos.ingest;

import java.util.List;

/**
 * Per-item outcomes of a batch, in upload order.
 */
public record BatchReport(List<ItemOutcome> outcomes) {

    public BatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public List<PreparedHighlight> accepted() {
        return outcomes.stream()
                .filter(o -> o.status() == EItemStatus.ACCEPTED)
                .map(ItemOutcome::prepared)
                .toList();
    }

    public long count(final EItemStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }
}
