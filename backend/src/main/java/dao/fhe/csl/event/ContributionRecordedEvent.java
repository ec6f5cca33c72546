package dao.fhe.csl.event;

public record ContributionRecordedEvent(
        long batchId,
        int index,
        String provider,
        String handle,
        long cost,
        long budget,
        long timestamp
) implements LedgerEvent {}
