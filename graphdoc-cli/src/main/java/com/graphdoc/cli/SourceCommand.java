package com.graphdoc.cli;

import com.graphdoc.core.config.ConfigLoader;
import com.graphdoc.core.config.GraphDocConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Options shared by the commands working on a source tree.
 */
abstract class SourceCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SourceCommand.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: graphdoc.yaml)"
    )
    Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-s", "--source"},
        description = "Source root (overrides config)"
    )
    Path sourceRoot;

    @Option(
        names = {"-o", "--output"},
        description = "Documentation directory (overrides config)"
    )
    Path outputDir;

    /**
     * Loads the configuration and applies the command line overrides.
     *
     * @return configuration
     */
    GraphDocConfig loadConfiguration() {
        log.debug("Loading configuration from: {}", configPath.toAbsolutePath());
        GraphDocConfig config = ConfigLoader.load(configPath);
        return config.withRoots(
            sourceRoot == null ? null : sourceRoot.toString(),
            outputDir == null ? null : outputDir.toString());
    }
}
