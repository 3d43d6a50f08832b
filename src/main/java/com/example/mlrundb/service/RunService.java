package com.example.mlrundb.service;

import com.example.mlrundb.codec.DocumentCodec;
import com.example.mlrundb.codec.DocumentFormat;
import com.example.mlrundb.encode.AttributeEncoder;
import com.example.mlrundb.encode.AttributeNames;
import com.example.mlrundb.encode.EnvelopeReader;
import com.example.mlrundb.error.FormatException;
import com.example.mlrundb.filter.FilterExpressionBuilder;
import com.example.mlrundb.model.RunMetadataEnvelope;
import com.example.mlrundb.patch.MergePatchEngine;
import com.example.mlrundb.store.StoreClient;
import com.example.mlrundb.store.StorePaths;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class RunService {

    private static final Logger logger = LoggerFactory.getLogger(RunService.class);

    public static final String COLLECTION = "runs";

    private final MetadataObjectStore objects;
    private final StoreClient store;
    private final DocumentCodec codec;
    private final EnvelopeReader envelopes;
    private final AttributeEncoder encoder;
    private final MergePatchEngine patches;
    private final FilterExpressionBuilder filters;

    @Value("${app.update.reindex-from-merged:true}")
    private boolean reindexFromMerged = true;

    public RunService(MetadataObjectStore objects, StoreClient store, DocumentCodec codec, EnvelopeReader envelopes,
                      AttributeEncoder encoder, MergePatchEngine patches, FilterExpressionBuilder filters) {
        this.objects = objects;
        this.store = store;
        this.codec = codec;
        this.envelopes = envelopes;
        this.encoder = encoder;
        this.patches = patches;
        this.filters = filters;
    }

    public void store(String project, String uid, byte[] document) {
        objects.storeObject(StorePaths.run(project, uid), document, RunMetadataEnvelope.class, Map.of());
    }

    /**
     * Merges a dot-path patch into the stored run. The stored document keeps its format
     * (YAML stays YAML).
     *
     * <p>Read and write are separate backend calls; a concurrent update of the same run
     * between the two is lost.
     */
    public void update(String project, String uid, byte[] patchBody) {
        String path = StorePaths.run(project, uid);
        byte[] patchJson = codec.toJson(patchBody);
        ObjectNode patch = patches.parsePatch(patchJson);

        byte[] oldDocument = objects.readObject(path);
        DocumentFormat format = codec.detect(oldDocument);
        byte[] mergedJson = patches.merge(codec.toJson(oldDocument), patchJson);
        byte[] newDocument = codec.fromJson(mergedJson, format);

        if (reindexFromMerged) {
            Map<String, Object> attributes = encoder.flatten(envelopes.read(codec.readTree(mergedJson), RunMetadataEnvelope.class));
            attributes.put(AttributeNames.DATA, newDocument);
            store.put(path, attributes);
        } else {
            // only attributes the patch names are refreshed
            Map<String, Object> attributes = encoder.flatten(envelopes.read(patches.expand(patch), RunMetadataEnvelope.class));
            attributes.put(AttributeNames.DATA, newDocument);
            store.update(path, attributes);
        }
        logger.info("Updated {} with {} patch key(s)", path, patch.size());
    }

    /** {@code {"data": <run>}}. */
    public byte[] read(String project, String uid) {
        return objects.readWrapped(StorePaths.run(project, uid));
    }

    public void delete(String project, String uid) {
        objects.delete(StorePaths.run(project, uid));
    }

    /** {@code {"runs": [...]}}; an unknown project lists nothing. */
    public byte[] list(ListQuery query) {
        String project = requireProject(query);
        String filter = filters.runFilter(query.getLabels(), query.getName(), query.getState(), query.getUpdatedAfter());
        return objects.list(StorePaths.runs(project), filter, query.isSort(), query.getLimit(), COLLECTION);
    }

    public int deleteByQuery(ListQuery query) {
        String project = requireProject(query);
        String filter = filters.runFilter(query.getLabels(), query.getName(), query.getState(), query.getUpdatedAfter());
        return objects.deleteMatching(StorePaths.runs(project), filter);
    }

    static String requireProject(ListQuery query) {
        if (query.getProject() == null || query.getProject().isEmpty()) {
            throw new FormatException("Expecting 'project' parameter");
        }
        return query.getProject();
    }
}
