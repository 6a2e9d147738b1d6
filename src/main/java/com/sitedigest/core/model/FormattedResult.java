package com.sitedigest.core.model;

import java.io.Serializable;

/**
 * One summarized page: the page URL plus its {@link PageSummary}.
 */
public record FormattedResult(
    String url,
    PageSummary response
) implements Serializable {}
