package star.engine.catalog;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Loads and saves the catalog manifest as JSON.
 * Saving goes through a temp file and a rename so a reader never sees a half-written manifest.
 */
public final class ManifestStore {
    public static final String MANIFEST_FILE = "manifest.json";
    private static final String TEMP_SUFFIX = ".tmp";

    private static final Logger log = LoggerFactory.getLogger(ManifestStore.class);

    private final Gson gson = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

    public static Path manifestPath(Path catalogDir) {
        return catalogDir.resolve(MANIFEST_FILE);
    }

    public static boolean exists(Path catalogDir) {
        return Files.isRegularFile(manifestPath(catalogDir));
    }

    public Manifest read(Path catalogDir) {
        Path file = manifestPath(catalogDir);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Manifest m = gson.fromJson(reader, Manifest.class);
            if (m == null) throw new CorruptCatalogException("Manifest is empty: " + file);
            checkComplete(m, file);
            return m;
        } catch (NoSuchFileException e) {
            throw new CorruptCatalogException("No manifest at " + file + " (missing or unfinished build)", e);
        } catch (IOException | JsonParseException e) {
            throw new CorruptCatalogException("Failed reading manifest: " + file, e);
        }
    }

    // Gson leaves absent fields null; a reader must see every field a build writes.
    private static void checkComplete(Manifest m, Path file) {
        require(m.buildId(), "buildId", file);
        require(m.compression(), "compression", file);
        require(m.counts(), "counts", file);
        requireElements(m.schema(), "schema", file);
        for (ColumnSchema c : m.schema()) {
            require(c.name(), "schema[].name", file);
            require(c.type(), "schema[].type", file);
            require(c.presence(), "schema[].presence", file);
        }
        requireElements(m.columns(), "columns", file);
        requireElements(m.sortingColumns(), "sortingColumns", file);
        requireElements(m.partitionColumns(), "partitionColumns", file);
        requireElements(m.partitions(), "partitions", file);
        for (PartitionMeta p : m.partitions()) {
            require(p.path(), "partitions[].path", file);
            requireElements(p.values(), "partitions[].values", file);
            for (PartitionValue v : p.values()) require(v.column(), "partitions[].values[].column", file);
            requireElements(p.rowGroups(), "partitions[].rowGroups", file);
            for (RowGroupMeta rg : p.rowGroups()) {
                requireElements(rg.firstKey(), "rowGroups[].firstKey", file);
                requireElements(rg.lastKey(), "rowGroups[].lastKey", file);
                requireElements(rg.statistics(), "rowGroups[].statistics", file);
                for (ColumnStatistics st : rg.statistics()) require(st.column(), "statistics[].column", file);
            }
        }
    }

    private static void require(Object value, String field, Path file) {
        if (value == null) throw new CorruptCatalogException("Manifest field '" + field + "' is missing: " + file);
    }

    private static void requireElements(List<?> values, String field, Path file) {
        require(values, field, file);
        for (Object v : values) require(v, field + "[]", file);
    }

    public void writeAtomically(Path catalogDir, Manifest manifest) throws IOException {
        Path target = manifestPath(catalogDir);
        Path temp = catalogDir.resolve(MANIFEST_FILE + TEMP_SUFFIX);
        try (FileChannel fc = FileChannel.open(temp, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                 StandardOpenOption.WRITE);
             OutputStream output = Channels.newOutputStream(fc);
             Writer writer = new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8))) {
            gson.toJson(manifest, writer);
            writer.flush();
            fc.force(true);
        }
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename not supported under {}, falling back to plain replace", catalogDir);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        syncDirectory(catalogDir);
    }

    /**
     * Forces a directory's entries (created or renamed files) to disk.
     * Some platforms cannot open a directory as a channel; there the sync is skipped with a warning.
     */
    public static void syncDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) throw new NoSuchFileException(dir.toString());
        FileChannel fc;
        try {
            fc = FileChannel.open(dir, StandardOpenOption.READ);
        } catch (IOException | UnsupportedOperationException e) {
            log.warn("Cannot open directory {} for sync, skipping: {}", dir, e.toString());
            return;
        }
        try (FileChannel toClose = fc) {
            toClose.force(true);
        }
    }

    public String toJson(Manifest manifest) {
        return gson.toJson(manifest);
    }
}
