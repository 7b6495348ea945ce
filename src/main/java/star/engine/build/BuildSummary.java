package star.engine.build;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import star.engine.catalog.BuildCounts;

/**
 * Outcome of a successful build. errors holds the first messages of invalid records.
 */
public record BuildSummary(Path output,
                           String buildId,
                           long accepted,
                           long rejected,
                           long invalid,
                           List<String> errors,
                           int partitions,
                           int rowGroups,
                           Duration duration) {

    public long count(RecordOutcome outcome) {
        return switch (outcome) {
            case ACCEPTED -> accepted;
            case REJECTED -> rejected;
            case INVALID -> invalid;
        };
    }

    public long seen() {
        return accepted + rejected + invalid;
    }

    public BuildCounts counts() {
        return new BuildCounts(accepted, rejected, invalid, duration.toMillis());
    }

    @Override
    public String toString() {
        return "accepted=" + accepted + " rejected=" + rejected + " invalid=" + invalid
            + " partitions=" + partitions + " rowGroups=" + rowGroups
            + " duration=" + duration.toMillis() + "ms output=" + output;
    }
}
