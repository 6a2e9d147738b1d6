package com.sitedigest.core.filter;

import com.sitedigest.core.config.PipelineProperties;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A category of links that are never worth summarizing (login pages,
 * checkout flows, downloads, ...), identified by a regex searched in the
 * lower-cased path and query of a link.
 */
public record ExclusionRule(String category, Pattern pattern) {

    public static ExclusionRule of(String category, String regex) {
        return new ExclusionRule(category, Pattern.compile(regex));
    }

    public boolean matches(String pathAndQuery) {
        return pattern.matcher(pathAndQuery).find();
    }

    public static List<ExclusionRule> fromProperties(List<PipelineProperties.Exclusion> exclusions) {
        return exclusions.stream()
                .map(e -> of(e.getCategory(), e.getPattern()))
                .toList();
    }
}
