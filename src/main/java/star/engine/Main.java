package star.engine;

import star.engine.catalog.CatalogException;
import star.engine.cli.CliOptions;
import star.engine.cli.Commands;

public class Main {
    public static void main(String[] args) {
        if (args.length == 0) {
            usage();
            System.exit(2);
        }
        Commands commands = new Commands(System.out);
        try {
            CliOptions options = CliOptions.fromArgs(args);
            switch (args[0]) {
                case "build-demo" -> commands.buildDemo(options);
                case "build" -> commands.build(options);
                case "info" -> commands.info(options);
                case "scan" -> commands.scan(options);
                case "get" -> commands.get(options);
                default -> {
                    usage();
                    System.exit(2);
                }
            }
        } catch (CatalogException | IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.exit(1);
        }
    }

    private static void usage() {
        System.err.println("Usage:");
        System.err.println("  build-demo OUTPUT_DIR [--count=N] [--seed=S] [--mag=16,11] [--version=V] [--resolution=R] [--workers=W]");
        System.err.println("  build PROPERTIES_FILE [--count=N] [--seed=S] [--mag=LIMIT]");
        System.err.println("  info CATALOG_DIR [--resolution=R]");
        System.err.println("  scan CATALOG_DIR [--limit=N] [--resolution=R]");
        System.err.println("  get CATALOG_DIR \"name = 'Sirius'\" [--resolution=R]");
    }
}

/* -------------------------------------------------------------------------
 * Example lookups against a demo catalog:
 * 1. get build/stars.0.1.0.mag16 "name = 'Sirius'"
 * 2. get build/stars.0.1.0.mag16 "hip = 91262"
 * 3. get build/stars.0.1.0.mag16 "constellation_id = 'ori' AND magnitude = 0.18"
 * 4. get build/stars.0.1.0.mag16 "name = 'Vega' OR name = 'Polaris'"
 * ------------------------------------------------------------------------- */
