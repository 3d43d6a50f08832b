package com.example.mlrundb.model;

import com.example.mlrundb.encode.AttributeSource;
import com.example.mlrundb.encode.AttributeWriter;
import com.example.mlrundb.encode.Sentinels;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Indexable part of a run document. Fields start out at their sentinel. */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunMetadataEnvelope implements AttributeSource {

    private Metadata metadata = new Metadata();
    private Status status = new Status();

    @Override
    public void writeTo(AttributeWriter writer) {
        writer.nested("metadata", metadata);
        writer.nested("status", status);
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata implements AttributeSource {
        private String name = Sentinels.INVALID_STRING;
        private String uid = Sentinels.INVALID_STRING;
        private long iteration = Sentinels.INVALID_INT;
        private String project = Sentinels.INVALID_STRING;
        private Map<String, Object> labels;

        @Override
        public void writeTo(AttributeWriter writer) {
            writer.string("name", name);
            writer.string("uid", uid);
            writer.integer("iteration", iteration);
            writer.string("project", project);
            writer.labels("labels", labels);
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Status implements AttributeSource {
        private String state = Sentinels.INVALID_STRING;
        @JsonProperty("last_update")
        private String lastTime = Sentinels.INVALID_STRING;
        @JsonProperty("start_time")
        private String startTime = Sentinels.INVALID_STRING;

        @Override
        public void writeTo(AttributeWriter writer) {
            writer.string("state", state);
            writer.string("lasttime", lastTime);
            writer.string("starttime", startTime);
        }
    }
}
