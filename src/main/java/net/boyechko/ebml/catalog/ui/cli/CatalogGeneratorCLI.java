/*
 * EBML-Catalog - EBML/Matroska schema catalog generator
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.ebml.catalog.ui.cli;

import ch.qos.logback.classic.Level;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import net.boyechko.ebml.catalog.catalog.Catalog;
import net.boyechko.ebml.catalog.config.GeneratorConfig;
import net.boyechko.ebml.catalog.core.CatalogService;
import net.boyechko.ebml.catalog.core.GenerationListener;
import net.boyechko.ebml.catalog.core.VerbosityLevel;
import net.boyechko.ebml.catalog.emit.CatalogDump;
import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.schema.CachingSchemaFetcher;
import net.boyechko.ebml.catalog.ui.GenerationReporter;
import net.boyechko.ebml.catalog.ui.LoggingListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CatalogGeneratorCLI {
    static final String CACHE_DIR_PROPERTY = "ebml.catalog.cache.dir";
    static final String CACHE_DIR_ENV = "EBML_CATALOG_CACHE_DIR";
    private static final String APP_LOGGER = "net.boyechko.ebml.catalog";
    private static final String PROGRESS_LOGGER = "net.boyechko.ebml.catalog.generation";

    private static Logger logger;

    enum DumpFormat {
        NONE,
        TEXT,
        YAML
    }

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path configPath,
            Path outputDirectory,
            Path cacheDirectory,
            boolean offline,
            boolean cacheDownloads,
            boolean logOutput,
            DumpFormat dump,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (dump == null) {
                throw new IllegalArgumentException("Dump format is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments. */
    static class CLIConfigBuilder {
        Path configPath;
        Path outputDirectory;
        Path cacheDirectory;
        boolean offline;
        boolean cacheDownloads;
        boolean logOutput;
        DumpFormat dump = DumpFormat.NONE;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() {
            return new CLIConfig(
                    configPath,
                    outputDirectory,
                    cacheDirectory,
                    offline,
                    cacheDownloads,
                    logOutput,
                    dump,
                    verbosity);
        }
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /** Runs the generator and returns the process exit status. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (isHelpRequested(args)) {
            out.println(usageMessage());
            return 0;
        }
        CLIConfig config;
        try {
            config = parseArguments(args);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        configureLogging(config);

        GenerationReporter reporter = null;
        GenerationListener listener = GenerationListener.silent();
        try {
            GeneratorConfig generatorConfig =
                    config.configPath() != null
                            ? GeneratorConfig.fromFile(config.configPath())
                            : GeneratorConfig.loadDefault();
            Path cacheDirectory = resolveCacheDirectory(config, generatorConfig);
            logger().info("Using schema cache directory {}", cacheDirectory);

            // Dump modes stay silent so stdout remains parseable
            if (config.logOutput()) {
                listener = LoggingListener.withConsoleOutput();
            } else if (config.dump() == DumpFormat.NONE) {
                reporter = new GenerationReporter(out, config.verbosity());
                listener = reporter;
            }

            CatalogService service =
                    new CatalogService.CatalogServiceBuilder()
                            .withConfig(generatorConfig)
                            .withFetcher(
                                    new CachingSchemaFetcher(
                                            cacheDirectory, config.offline(), config.cacheDownloads()))
                            .withListener(listener)
                            .build();

            if (config.dump() != DumpFormat.NONE) {
                Catalog catalog = service.buildCatalog();
                out.print(
                        config.dump() == DumpFormat.YAML
                                ? CatalogDump.toYaml(catalog)
                                : CatalogDump.toIndentedString(catalog));
                return 0;
            }

            Path outputDirectory =
                    config.outputDirectory() != null
                            ? config.outputDirectory()
                            : Paths.get(generatorConfig.output.directory);
            service.generate(outputDirectory);
            return 0;
        } catch (CatalogException e) {
            logger().debug("Generation aborted", e);
            listener.onError(e.describe());
            if (reporter != null) {
                reporter.finish();
            }
            err.println("Error: " + e.describe());
            return 1;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--config=")) {
                b.configPath = Paths.get(args[i].substring("--config=".length()));
            } else if (args[i].startsWith("--output=")) {
                b.outputDirectory = Paths.get(args[i].substring("--output=".length()));
            } else if (args[i].startsWith("--cache-dir=")) {
                b.cacheDirectory = Paths.get(args[i].substring("--cache-dir=".length()));
            } else {
                switch (args[i]) {
                    case "-c", "--config" -> b.configPath = Paths.get(requireValue(args, ++i, "-c"));
                    case "-o", "--output" -> b.outputDirectory = Paths.get(requireValue(args, ++i, "-o"));
                    case "--cache-dir" -> b.cacheDirectory = Paths.get(requireValue(args, ++i, "--cache-dir"));
                    case "--offline" -> b.offline = true;
                    case "--cache-downloads" -> b.cacheDownloads = true;
                    case "--log" -> b.logOutput = true;
                    case "--dump-catalog" -> b.dump = DumpFormat.TEXT;
                    case "--dump-yaml" -> b.dump = DumpFormat.YAML;
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    default -> throw new CLIException("Unknown argument: " + args[i] + "\n" + usageMessage());
                }
            }
        }
        if (b.offline && b.cacheDownloads) {
            throw new CLIException("--cache-downloads has no effect with --offline");
        }
        return b.build();
    }

    private static String requireValue(String[] args, int index, String option) throws CLIException {
        if (index >= args.length || args[index].startsWith("-")) {
            throw new CLIException("Value not specified after " + option);
        }
        return args[index];
    }

    /**
     * Cache directory, first match wins: command line, {@value #CACHE_DIR_PROPERTY} JVM property,
     * {@value #CACHE_DIR_ENV} environment variable, configuration file, working directory.
     */
    static Path resolveCacheDirectory(CLIConfig config, GeneratorConfig generatorConfig) {
        if (config.cacheDirectory() != null) return config.cacheDirectory();

        String sysProp = System.getProperty(CACHE_DIR_PROPERTY);
        if (sysProp != null) return Path.of(sysProp);

        String envVar = System.getenv(CACHE_DIR_ENV);
        if (envVar != null) return Path.of(envVar);

        if (generatorConfig.cache_directory != null) return Path.of(generatorConfig.cache_directory);

        return Path.of("");
    }

    private static void configureLogging(CLIConfig config) {
        Level level = Level.toLevel(config.verbosity().logLevel());
        for (String name : new String[] {Logger.ROOT_LOGGER_NAME, APP_LOGGER}) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(name)).setLevel(level);
        }
        // Progress events are logged at INFO
        if (config.logOutput() && !level.isGreaterOrEqual(Level.ERROR)) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(PROGRESS_LOGGER))
                    .setLevel(level.isGreaterOrEqual(Level.INFO) ? Level.INFO : level);
        }
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(CatalogGeneratorCLI.class);
        }
        return logger;
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static String usageMessage() {
        return "Usage: java CatalogGeneratorCLI [-c config.yaml] [-o dir] [--cache-dir dir] [--offline] [-q|-v|-vv]\n"
                + "  -h, --help          Show this help message\n"
                + "  -c, --config        Generator configuration (default: bundled ebml-catalog.yaml)\n"
                + "  -o, --output        Directory for the generated sources (default: from config)\n"
                + "  --cache-dir         Directory searched for cached schema documents\n"
                + "  --offline           Never download; every schema must be in the cache\n"
                + "  --cache-downloads   Save downloaded schema documents to the cache directory\n"
                + "  --dump-catalog      Print the resolved catalog as a text tree and exit\n"
                + "  --dump-yaml         Print the resolved catalog as YAML and exit\n"
                + "  --log               Report progress through the logger instead of the console boxes\n"
                + "  -q, --quiet         Only show errors\n"
                + "  -v, --verbose       Show detailed processing information\n"
                + "  -vv, --debug        Show all debug information\n"
                + "Examples:\n"
                + "  java CatalogGeneratorCLI -o src/main/java/org/ebml/matroska\n"
                + "  java CatalogGeneratorCLI --offline --cache-dir schemas --dump-catalog\n"
                + "  java CatalogGeneratorCLI --cache-downloads --cache-dir schemas -v";
    }
}
