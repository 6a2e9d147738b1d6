package com.sitedigest.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sitedigest.core.capability.CapabilityException;
import com.sitedigest.core.capability.ResultSink;
import com.sitedigest.core.config.PipelineProperties;
import com.sitedigest.core.model.ScrapeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes each job's result to {@code <output-dir>/<jobId>.json}.
 * <p>
 * The file is written to a sibling temp file first and then moved into place,
 * so a reader never sees a half-written artifact. Rewriting the same result
 * replaces the file with identical bytes.
 */
@Service
public class JsonFileResultSink implements ResultSink {

    private static final Logger log = LoggerFactory.getLogger(JsonFileResultSink.class);

    private final Path outputDir;
    private final ObjectMapper mapper;

    public JsonFileResultSink(PipelineProperties properties) {
        this(Path.of(properties.getOutputDir()));
    }

    public JsonFileResultSink(Path outputDir) {
        this.outputDir = outputDir;
        this.mapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    @Override
    public void persist(String jobId, ScrapeResult result) {
        if (jobId == null || jobId.isBlank() || jobId.contains("/") || jobId.contains("\\") || jobId.contains("..")) {
            throw CapabilityException.terminal("Invalid job id for result file: " + jobId, null);
        }
        Path target = fileFor(jobId);
        try {
            Files.createDirectories(outputDir);
            byte[] bytes = mapper.writeValueAsBytes(result);
            Path tmp = outputDir.resolve(jobId + ".json.tmp");
            Files.write(tmp, bytes);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Wrote {} summaries to {}", result.data().size(), target);
        } catch (IOException e) {
            throw CapabilityException.retryable("Failed to write result file " + target + ": " + e.getMessage(), e);
        }
    }

    public Path fileFor(String jobId) {
        return outputDir.resolve(jobId + ".json");
    }
}
