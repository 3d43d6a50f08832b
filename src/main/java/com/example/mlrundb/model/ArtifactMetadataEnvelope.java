package com.example.mlrundb.model;

import com.example.mlrundb.encode.AttributeSource;
import com.example.mlrundb.encode.AttributeWriter;
import com.example.mlrundb.encode.Sentinels;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Indexable part of an artifact document: its key (indexed as {@code name}) and labels. */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArtifactMetadataEnvelope implements AttributeSource {

    @JsonProperty("key")
    private String name = Sentinels.INVALID_STRING;
    private Map<String, Object> labels;

    @Override
    public void writeTo(AttributeWriter writer) {
        writer.string("name", name);
        writer.labels("labels", labels);
    }
}
