package star.engine.build;

/**
 * Acceptance test applied to each valid record before it is buffered.
 * Rejected records are counted, never assigned a pk and never stored.
 */
@FunctionalInterface
public interface RecordFilter {
    RecordFilter ACCEPT_ALL = r -> true;

    boolean accept(SourceRecord record);
}
