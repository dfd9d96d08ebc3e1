package co.keyfmt.generators.java;

import co.keyfmt.core.index.IndexRegistry;
import co.keyfmt.core.model.IndexSchema;
import co.keyfmt.core.model.IndexSchemaBinder;
import co.keyfmt.core.model.IndexSchemaBinder.BoundSchema;
import co.keyfmt.core.model.IndexSchemaLoader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI entry point for the Java key generator.
 *
 * Usage:
 *   java -jar codegen-java.jar --schemas <json-array> --package <pkg> --output <dir>
 *   java -jar codegen-java.jar --schemas-file <path> --package <pkg> --output <dir>
 */
public class Main {

    static final String USAGE =
        "Usage: java -jar codegen-java.jar [--schemas <json-array> | --schemas-file <path>] --package <pkg> --output <dir>";

    public static void main(String[] args) {
        try {
            System.exit(run(args));
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Run the generator and return the process exit code.
     */
    static int run(String[] args) throws Exception {
        String schemasJson = null;     // One schema or a JSON array of them
        String schemasFile = null;     // Path to file containing schemas JSON
        String packageName = null;
        String outputDir = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--schemas":
                    schemasJson = value(args, ++i);
                    break;
                case "--schemas-file":
                    schemasFile = value(args, ++i);
                    break;
                case "--package":
                    packageName = value(args, ++i);
                    break;
                case "--output":
                    outputDir = value(args, ++i);
                    break;
                default:
                    // Skip unknown args
                    break;
            }
        }

        boolean hasSchemaInput = schemasJson != null || schemasFile != null;
        if (!hasSchemaInput || packageName == null || outputDir == null) {
            System.err.println(USAGE);
            return 1;
        }

        String json = schemasFile != null ? Files.readString(Path.of(schemasFile)) : schemasJson;
        List<IndexSchema> schemas = IndexSchemaLoader.parseAll(json);
        if (schemas.isEmpty()) {
            System.err.println("Error: No schemas provided");
            return 1;
        }

        IndexRegistry registry = new IndexRegistry();
        Map<String, BoundSchema> bound = new LinkedHashMap<>();
        for (IndexSchema schema : schemas) {
            BoundSchema b = IndexSchemaBinder.bind(schema);
            if (bound.putIfAbsent(b.entityName(), b) != null) {
                throw new IllegalArgumentException("duplicate entity " + b.entityName());
            }
            registry.register(b.entityName(), b.index());
        }

        List<Path> files = new JavaKeyGenerator().generateAll(registry, bound, packageName, Paths.get(outputDir));

        System.out.println("Generated key builders for " + files.size() + " entity/entities in " + outputDir);
        for (IndexRegistry.Entry entry : registry.all()) {
            System.out.println("  - " + entry.entityName() + " (" + entry.index().tableName() + ")");
        }
        return 0;
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("missing value for " + args[i - 1]);
        }
        return args[i];
    }
}
