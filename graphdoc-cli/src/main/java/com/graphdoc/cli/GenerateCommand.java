package com.graphdoc.cli;

import com.graphdoc.core.config.GraphDocConfig;
import com.graphdoc.core.generator.DocumentationRunner;
import com.graphdoc.core.generator.GenerationReport;
import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphPackage;
import com.graphdoc.core.source.GraphSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * Command to regenerate the documentation of a source tree.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Use graphdoc.yaml of the current directory
 * graphdoc generate
 *
 * # Override source and documentation roots
 * graphdoc generate -s ./graphs -o ./docs/org
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Regenerate documentation, keeping manually written text",
    mixinStandardHelpOptions = true
)
public class GenerateCommand extends SourceCommand {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Override
    public Integer call() {
        try {
            GraphDocConfig config = loadConfiguration();
            GraphSource source = GraphSource.fromConfig(config);

            List<GraphPackage> packages = source.readPackages(GraphSource.packageRoot(config));
            int customNodes = packages.stream().mapToInt(graphPackage -> graphPackage.customNodes().size()).sum();
            System.out.println("✓ Read " + packages.size() + " packages with " + customNodes + " custom nodes");

            List<GraphFile> scripts = source.readScripts(GraphSource.scriptRoot(config));
            System.out.println("✓ Read " + scripts.size() + " scripts");

            GenerationReport report = DocumentationRunner.fromConfig(config).generate(scripts, packages);
            System.out.println("✓ Wrote " + report.written().size() + " documents to: " + config.output().directory());
            if (!report.deleted().isEmpty()) {
                System.out.println("✓ Deleted " + report.deleted().size() + " stale documents");
            }

            if (report.hasFailures()) {
                System.err.println();
                System.err.println("✗ " + report.failures().size() + " files could not be documented:");
                report.failures().forEach(failure ->
                    System.err.println("  - " + failure.source() + ": " + failure.message()));
                return 1;
            }

            System.out.println();
            System.out.println("✓ Generation complete");
            return 0;
        } catch (Exception e) {
            log.error("Generation failed", e);
            System.err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }
}
