package com.graphdoc.cli;

import com.graphdoc.core.config.GraphDocConfig;
import com.graphdoc.core.markup.FileDocumentation;
import com.graphdoc.core.markup.NodeAnnotationLinker;
import com.graphdoc.core.markup.UnresolvedAnnotationException;
import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphPackage;
import com.graphdoc.core.source.GraphSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

import java.util.ArrayList;
import java.util.List;

/**
 * Command to check that the markup of every graph file can be linked to its nodes.
 *
 * <p>Nothing is written. Exits with 1 if any annotation cannot be resolved.
 */
@Command(
    name = "validate",
    description = "Check that every annotation can be linked to a node",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends SourceCommand {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Override
    public Integer call() {
        GraphDocConfig config = loadConfiguration();
        GraphSource source = GraphSource.fromConfig(config);

        List<GraphFile> files = new ArrayList<>(source.readScripts(GraphSource.scriptRoot(config)));
        for (GraphPackage graphPackage : source.readPackages(GraphSource.packageRoot(config))) {
            files.addAll(graphPackage.customNodes());
        }

        NodeAnnotationLinker linker = new NodeAnnotationLinker();
        int markups = 0;
        int errors = 0;
        for (GraphFile file : files) {
            try {
                FileDocumentation documentation = linker.link(file);
                markups += documentation.size();
            } catch (UnresolvedAnnotationException e) {
                log.debug("Validation failed for {}", file.path(), e);
                System.err.println("✗ " + e.getMessage());
                errors++;
            }
        }

        System.out.println("✓ Checked " + files.size() + " files, " + markups + " section markups linked");
        if (errors > 0) {
            System.err.println("✗ " + errors + " files with unresolved annotations");
            return 1;
        }
        return 0;
    }
}
