package star.engine.build;

// What happened to one input record.
public enum RecordOutcome {
    ACCEPTED,
    REJECTED, // filtered out by threshold; not an error
    INVALID   // failed validation
}
