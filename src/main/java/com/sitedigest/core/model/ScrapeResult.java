package com.sitedigest.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;

/**
 * Final output of a completed job and the shape of the persisted artifact:
 * {@code {"source_url": ..., "data": [{"url": ..., "response": {"title": ..., "description": ...}}]}}.
 */
@JsonPropertyOrder({"source_url", "data"})
public record ScrapeResult(
    @JsonProperty("source_url") String sourceUrl,
    List<FormattedResult> data
) implements Serializable {

    public ScrapeResult {
        data = data == null ? List.of() : List.copyOf(data);
    }
}
