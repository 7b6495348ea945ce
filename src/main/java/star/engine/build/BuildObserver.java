package star.engine.build;

import java.nio.file.Path;

import star.engine.catalog.InvalidRecordException;

/**
 * Reporting sink passed into a build. All callbacks happen on the thread running the build.
 */
public interface BuildObserver {
    BuildObserver NONE = new BuildObserver() {};

    default void onBuildStarted(BuildConfig config) {}

    /** sequence is the 1-based position of the record in the input. */
    default void onRecordInvalid(long sequence, InvalidRecordException error) {}

    default void onChunkSpilled(int chunkIndex, int records) {}

    default void onRowGroupWritten(String partition, int rowGroup, int records) {}

    default void onBuildCompleted(BuildSummary summary) {}

    default void onBuildFailed(Path output, Exception error) {}
}
