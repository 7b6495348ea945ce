package star.engine.build;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import star.engine.catalog.CatalogBuildException;
import star.engine.catalog.ConfigurationException;
import star.engine.catalog.Manifest;
import star.engine.catalog.ManifestStore;
import star.engine.catalog.PartitionMeta;

/**
 * Builds a catalog store from a record stream.
 *
 * The output directory must be absent or empty: a store is never updated in place.
 * The manifest is written last; any failure removes what the build wrote, so a
 * directory without a manifest is never a catalog.
 */
public class CatalogBuilder {
    static final String RUN_DIR = "_runs";
    private static final Logger log = LoggerFactory.getLogger(CatalogBuilder.class);

    private final BuildConfig config;
    private final ManifestStore manifests = new ManifestStore();

    public CatalogBuilder(BuildConfig config) {
        if (config == null) throw new ConfigurationException("Build configuration is required");
        this.config = config;
    }

    public BuildSummary build(Iterator<SourceRecord> records, RecordFilter filter) {
        return build(records, filter, new LoggingBuildObserver());
    }

    public BuildSummary build(Iterable<SourceRecord> records, RecordFilter filter, BuildObserver observer) {
        return build(records.iterator(), filter, observer);
    }

    public BuildSummary build(Iterator<SourceRecord> records, RecordFilter filter, BuildObserver observer) {
        if (records == null) throw new ConfigurationException("Record source is required");
        RecordFilter f = filter == null ? RecordFilter.ACCEPT_ALL : filter;
        BuildObserver obs = observer == null ? BuildObserver.NONE : observer;
        Path output = config.outputPath();
        boolean created = prepareOutput(output);

        Instant started = Instant.now();
        obs.onBuildStarted(config);
        Path runDir = output.resolve(RUN_DIR);
        try {
            Files.createDirectories(runDir);
            ChunkedSortPipeline pipeline = new ChunkedSortPipeline(config, f, obs, runDir);
            List<Path> runs = pipeline.run(records);

            CatalogWriter writer = new CatalogWriter(config, pipeline.order(), obs);
            List<PartitionMeta> partitions = writer.write(runs);
            deleteRecursively(runDir);

            String buildId = UUID.randomUUID().toString();
            Duration duration = Duration.between(started, Instant.now());
            int rowGroups = 0;
            for (PartitionMeta p : partitions) rowGroups += p.rowGroups().size();
            BuildSummary summary = new BuildSummary(output, buildId, pipeline.accepted(), pipeline.rejected(),
                pipeline.invalid(), pipeline.errors(), partitions.size(), rowGroups, duration);

            Manifest manifest = new Manifest(
                Manifest.FORMAT_VERSION,
                buildId,
                started.toString(),
                config.schema().columns(),
                config.schema().columnNames(),
                config.sortingColumns(),
                config.partitionColumns(),
                config.spatialResolution(),
                config.compression().name(),
                config.chunkSize(),
                config.rowGroupSize(),
                pipeline.accepted(),
                summary.counts(),
                partitions);
            manifests.writeAtomically(output, manifest);
            obs.onBuildCompleted(summary);
            return summary;
        } catch (IOException e) {
            discard(output, created);
            CatalogBuildException failure = new CatalogBuildException("Failed writing catalog to " + output, e);
            obs.onBuildFailed(output, failure);
            throw failure;
        } catch (RuntimeException e) {
            discard(output, created);
            obs.onBuildFailed(output, e);
            throw e;
        }
    }

    /** Returns true when the build created the output directory itself. */
    private static boolean prepareOutput(Path output) {
        if (Files.exists(output)) {
            if (!Files.isDirectory(output)) {
                throw new ConfigurationException("Output path exists and is not a directory: " + output);
            }
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(output)) {
                if (entries.iterator().hasNext()) {
                    throw new ConfigurationException("Output directory is not empty, catalogs are never rebuilt in place: " + output);
                }
            } catch (IOException e) {
                throw new CatalogBuildException("Cannot inspect output directory " + output, e);
            }
            return false;
        }
        try {
            Files.createDirectories(output);
        } catch (IOException e) {
            throw new CatalogBuildException("Cannot create output directory " + output, e);
        }
        return true;
    }

    private static void discard(Path output, boolean created) {
        try {
            if (created) {
                deleteRecursively(output);
            } else {
                try (DirectoryStream<Path> entries = Files.newDirectoryStream(output)) {
                    for (Path p : entries) deleteRecursively(p);
                }
            }
        } catch (IOException e) {
            log.warn("Could not fully remove partial catalog at {}", output, e);
        }
    }

    static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) return;
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(p);
            }
        }
    }
}
