package com.graphdoc.cli;

import com.graphdoc.core.config.GraphDocConfig;
import com.graphdoc.core.markup.Section;
import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphPackage;
import com.graphdoc.core.source.GraphSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;

/**
 * Command to list the section markers, scripts or packages.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * graphdoc list sections
 * graphdoc list scripts -s ./graphs
 * graphdoc list packages
 * }</pre>
 */
@Command(
    name = "list",
    description = "List section markers, scripts, or packages",
    mixinStandardHelpOptions = true
)
public class ListCommand extends SourceCommand {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: sections, scripts, or packages"
    )
    String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "sections", "section" -> listSections();
            case "scripts", "script" -> listScripts();
            case "packages", "package" -> listPackages();
            default -> {
                log.error("Unknown type: {}. Use: sections, scripts, or packages", type);
                yield 1;
            }
        };
    }

    private int listSections() {
        System.out.println("Section Markers:");
        System.out.println();
        for (Section section : Section.values()) {
            System.out.printf("  • %s %s (%s)%n", section.marker(), section.title(),
                section.scope().name().toLowerCase(Locale.ROOT));
        }
        return 0;
    }

    private int listScripts() {
        GraphDocConfig config = loadConfiguration();
        List<GraphFile> scripts = GraphSource.fromConfig(config).readScripts(GraphSource.scriptRoot(config));

        System.out.println("Scripts:");
        System.out.println();
        for (GraphFile script : scripts) {
            System.out.printf("  • %s (%d nodes)%n", script.path(), script.nodes().size());
        }
        if (scripts.isEmpty()) {
            System.out.println("  No scripts found.");
        }
        return 0;
    }

    private int listPackages() {
        GraphDocConfig config = loadConfiguration();
        List<GraphPackage> packages = GraphSource.fromConfig(config).readPackages(GraphSource.packageRoot(config));

        System.out.println("Packages:");
        System.out.println();
        for (GraphPackage graphPackage : packages) {
            System.out.printf("  • %s (%d custom nodes)%n", graphPackage.fullName(), graphPackage.customNodes().size());
        }
        if (packages.isEmpty()) {
            System.out.println("  No packages found.");
        }
        return 0;
    }
}
