package io.insights.retail;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Serializes a bundle as JSON: creation time, summary, record counts and a context sample of each dataset.
 */
public class SummaryJsonWriter {
    private final ObjectMapper mapper;
    private final int sampleSize;

    public SummaryJsonWriter(int sampleSize) {
        this.sampleSize = sampleSize;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public ObjectMapper mapper() { return mapper; }

    public String toJson(InsightsBundle bundle) throws IOException {
        return mapper.writeValueAsString(document(bundle));
    }

    public void write(InsightsBundle bundle, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        mapper.writeValue(file.toFile(), document(bundle));
    }

    private Document document(InsightsBundle bundle) {
        return new Document(bundle.createdAt(), bundle.summary(), bundle.dataStats(), bundle.contextSnapshot(sampleSize));
    }

    record Document(Instant createdAt, BusinessSummary summary, DataStats dataStats, ContextSnapshot context) {}
}
