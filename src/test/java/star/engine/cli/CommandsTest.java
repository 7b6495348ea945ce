package star.engine.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import star.engine.build.BuildSummary;
import star.engine.catalog.ConfigurationException;
import star.engine.catalog.IncompatibleCatalogException;

public class CommandsTest {
    @TempDir
    Path dir;

    private ByteArrayOutputStream bytes;
    private Commands commands;

    @BeforeEach
    void setUp() {
        bytes = new ByteArrayOutputStream();
        commands = new Commands(new PrintStream(bytes, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private static CliOptions args(String... args) {
        return CliOptions.fromArgs(args);
    }

    @Test
    void buildDemoBuildsVersionedCatalogsAndChecksThem() {
        List<BuildSummary> summaries = commands.buildDemo(
            args("build-demo", dir.toString(), "--count=3000", "--seed=4", "--workers=2"));
        assertEquals(2, summaries.size());
        assertTrue(Files.exists(dir.resolve("stars.0.1.0.mag16").resolve("manifest.json")));
        assertTrue(Files.exists(dir.resolve("stars.0.1.0.mag11").resolve("manifest.json")));
        assertEquals(3000, summaries.get(0).accepted());
        assertTrue(summaries.get(1).accepted() < summaries.get(0).accepted());
        assertTrue(output().contains("Checks passed!"));
    }

    @Test
    void infoScanAndGet() {
        commands.buildDemo(args("build-demo", dir.toString(), "--count=500", "--mag=16"));
        String catalog = dir.resolve("stars.0.1.0.mag16").toString();

        commands.info(args("info", catalog));
        assertTrue(output().contains("records:        500"));

        assertEquals(3, commands.scan(args("scan", catalog, "--limit=3")).size());
        assertTrue(output().contains("(3 row(s))"));
        assertTrue(output().contains("| pk "));

        assertTrue(commands.get(args("get", catalog, "name = 'Sirius'")).isPresent());
        assertTrue(output().contains("Sirius"));
        assertTrue(commands.get(args("get", catalog, "hip = 7")).isEmpty());
        assertTrue(output().contains("No record matches hip = 7"));

        assertThrows(IncompatibleCatalogException.class, () -> commands.info(args("info", catalog, "--resolution=3")));
    }

    @Test
    void buildFromPropertiesFile() throws IOException {
        Path props = dir.resolve("build.properties");
        Path out = dir.resolve("from-props");
        Files.writeString(props, String.join("\n",
            "catalog.output=" + out.toString().replace('\\', '/'),
            "catalog.chunk-size=100",
            "catalog.columns=hip,name,ra,dec,magnitude,constellation_id,epoch_year",
            "catalog.partition-columns=",
            "catalog.sorting-columns=magnitude",
            "catalog.compression=lz4",
            "catalog.row-group-size=50",
            "catalog.spatial-resolution=3"));
        BuildSummary summary = commands.build(args("build", props.toString(), "--count=200", "--mag=9"));
        assertTrue(summary.accepted() > 0 && summary.accepted() < 200);
        assertTrue(Files.exists(out.resolve("manifest.json")));
    }

    @Test
    void badArgumentsFailFast() {
        assertThrows(ConfigurationException.class, () -> args("scan", "x", "--limit=many"));
        assertThrows(ConfigurationException.class, () -> args("scan", "x", "--verbose"));
        assertThrows(ConfigurationException.class, () -> args("build", "x", "--config=build.properties"));
        assertThrows(ConfigurationException.class, () -> commands.scan(args("scan")));
    }

    @Test
    void integerFlagsAreRangeChecked() {
        // would wrap to 6 if narrowed from a long
        assertThrows(ConfigurationException.class, () -> args("info", "x", "--resolution=4294967302"));
        assertThrows(ConfigurationException.class, () -> args("info", "x", "--resolution=16"));
        assertThrows(ConfigurationException.class, () -> args("scan", "x", "--limit=-1"));
        assertThrows(ConfigurationException.class, () -> args("build-demo", "x", "--workers=0"));
        assertEquals(15, args("info", "x", "--resolution=15").resolution);
        assertEquals(3, args("build-demo", "x", "--workers=3").workers);
    }
}
