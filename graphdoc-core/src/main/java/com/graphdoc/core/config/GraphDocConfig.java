package com.graphdoc.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration of a GraphDoc run.
 *
 * <p>Loaded from {@code graphdoc.yaml}. Missing sections and values fall back to their
 * defaults, so a partial file is always usable.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * source:
 *   root: "./graphs"
 *   scriptFolder: "Scripts"
 *   packageFolder: "Packages"
 *
 * output:
 *   directory: "./docs/org"
 *   setupFile: "https://fniessen.github.io/org-html-themes/org/theme-readtheorg.setup"
 *
 * rendering:
 *   withCodeBlocks: true
 *   placeholder: "# (no manual documentation)"
 *
 * crawler:
 *   threads: 4
 *   excludedNames: ["backup", "archive", "old"]
 * }</pre>
 *
 * @param source source tree settings
 * @param output documentation tree settings
 * @param rendering document content settings
 * @param crawler source discovery settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphDocConfig(
    @JsonProperty("source") SourceConfig source,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("rendering") RenderingConfig rendering,
    @JsonProperty("crawler") CrawlerConfig crawler
) {
    /**
     * Compact constructor filling missing sections with defaults.
     */
    public GraphDocConfig {
        source = source == null ? SourceConfig.defaults() : source;
        output = output == null ? OutputConfig.defaults() : output;
        rendering = rendering == null ? RenderingConfig.defaults() : rendering;
        crawler = crawler == null ? CrawlerConfig.defaults() : crawler;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static GraphDocConfig defaults() {
        return new GraphDocConfig(null, null, null, null);
    }

    /**
     * Returns a copy with other source and output roots, used for command line overrides.
     *
     * @param sourceRoot source root, null keeps the configured one
     * @param outputDirectory documentation root, null keeps the configured one
     * @return new configuration
     */
    public GraphDocConfig withRoots(String sourceRoot, String outputDirectory) {
        SourceConfig newSource = sourceRoot == null ? source
            : new SourceConfig(sourceRoot, source.scriptFolder(), source.packageFolder());
        OutputConfig newOutput = outputDirectory == null ? output
            : new OutputConfig(outputDirectory, output.setupFile());
        return new GraphDocConfig(newSource, newOutput, rendering, crawler);
    }

    /**
     * Source tree settings.
     *
     * @param root root directory of the graph sources
     * @param scriptFolder folder of the scripts below the root
     * @param packageFolder folder of the packages below the root
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SourceConfig(
        @JsonProperty("root") String root,
        @JsonProperty("scriptFolder") String scriptFolder,
        @JsonProperty("packageFolder") String packageFolder
    ) {
        public SourceConfig {
            root = root == null ? "." : root;
            scriptFolder = scriptFolder == null ? "Scripts" : scriptFolder;
            packageFolder = packageFolder == null ? "Packages" : packageFolder;
        }

        public static SourceConfig defaults() {
            return new SourceConfig(null, null, null);
        }
    }

    /**
     * Documentation tree settings.
     *
     * @param directory documentation root
     * @param setupFile Org setup file referenced by every document, may be blank
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("setupFile") String setupFile
    ) {
        public OutputConfig {
            directory = directory == null ? "./docs/org" : directory;
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null, null);
        }
    }

    /**
     * Document content settings.
     *
     * @param withCodeBlocks whether code block nodes are documented
     * @param placeholder line standing for missing manual documentation
     * @param defaultValue cell text for missing values
     * @param trueValue cell text for {@code true}
     * @param falseValue cell text for {@code false}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RenderingConfig(
        @JsonProperty("withCodeBlocks") Boolean withCodeBlocks,
        @JsonProperty("placeholder") String placeholder,
        @JsonProperty("defaultValue") String defaultValue,
        @JsonProperty("trueValue") String trueValue,
        @JsonProperty("falseValue") String falseValue
    ) {
        /**
         * Default placeholder, an Org comment so it never shows in exported documents.
         */
        public static final String DEFAULT_PLACEHOLDER = "# (no manual documentation)";

        public RenderingConfig {
            withCodeBlocks = withCodeBlocks == null ? Boolean.TRUE : withCodeBlocks;
            placeholder = placeholder == null || placeholder.isBlank() ? DEFAULT_PLACEHOLDER : placeholder;
            defaultValue = defaultValue == null ? "n/a" : defaultValue;
            trueValue = trueValue == null ? "Yes" : trueValue;
            falseValue = falseValue == null ? "No" : falseValue;
        }

        public static RenderingConfig defaults() {
            return new RenderingConfig(null, null, null, null, null);
        }
    }

    /**
     * Source discovery settings.
     *
     * @param threads worker threads, one task per root
     * @param excludedNames directory names skipped while crawling, compared ignoring case
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CrawlerConfig(
        @JsonProperty("threads") Integer threads,
        @JsonProperty("excludedNames") List<String> excludedNames
    ) {
        public CrawlerConfig {
            threads = threads == null || threads < 1 ? 4 : threads;
            excludedNames = excludedNames == null ? List.of("backup", "archive", "old") : List.copyOf(excludedNames);
        }

        public static CrawlerConfig defaults() {
            return new CrawlerConfig(null, null);
        }
    }
}
