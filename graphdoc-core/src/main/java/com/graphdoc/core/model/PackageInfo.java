package com.graphdoc.core.model;

import java.util.List;

/**
 * Package manifest metadata.
 *
 * @param version package version
 * @param license license name
 * @param group publishing group
 * @param keywords search keywords
 * @param engineVersion host engine version the package was built for
 * @param siteUrl homepage
 * @param repositoryUrl source repository
 */
public record PackageInfo(
    String version,
    String license,
    String group,
    List<String> keywords,
    String engineVersion,
    String siteUrl,
    String repositoryUrl
) {
    public PackageInfo {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
