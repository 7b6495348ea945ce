package star.engine.build;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import star.engine.catalog.InvalidRecordException;

/**
 * Default observer: reports build progress through SLF4J.
 */
public class LoggingBuildObserver implements BuildObserver {
    private static final Logger log = LoggerFactory.getLogger(LoggingBuildObserver.class);

    @Override
    public void onBuildStarted(BuildConfig config) {
        log.info("Building catalog at {} (chunk={}, rowGroup={}, resolution={}, codec={})",
            config.outputPath(), config.chunkSize(), config.rowGroupSize(),
            config.spatialResolution(), config.compression());
    }

    @Override
    public void onRecordInvalid(long sequence, InvalidRecordException error) {
        log.debug("Record #{} invalid: {}", sequence, error.getMessage());
    }

    @Override
    public void onChunkSpilled(int chunkIndex, int records) {
        log.debug("Chunk {} sorted and spilled ({} records)", chunkIndex, records);
    }

    @Override
    public void onRowGroupWritten(String partition, int rowGroup, int records) {
        log.debug("Wrote row group {} of {} ({} records)", rowGroup, partition, records);
    }

    @Override
    public void onBuildCompleted(BuildSummary summary) {
        log.info("Catalog built: {}", summary);
    }

    @Override
    public void onBuildFailed(Path output, Exception error) {
        log.error("Catalog build failed, no catalog produced at {}", output, error);
    }
}
