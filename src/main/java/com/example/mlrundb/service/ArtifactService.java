package com.example.mlrundb.service;

import com.example.mlrundb.encode.AttributeNames;
import com.example.mlrundb.error.FormatException;
import com.example.mlrundb.filter.FilterExpressionBuilder;
import com.example.mlrundb.model.ArtifactMetadataEnvelope;
import com.example.mlrundb.store.StorePaths;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Artifacts are stored twice: under the uid of the run that produced them and under a
 * tag, {@code latest} unless given. Reads and deletes go through the tag record.
 */
@Service
public class ArtifactService {

    public static final String COLLECTION = "artifacts";
    public static final String DEFAULT_TAG = "latest";
    public static final String ANY_TAG = "*";

    private final MetadataObjectStore objects;
    private final FilterExpressionBuilder filters;

    public ArtifactService(MetadataObjectStore objects, FilterExpressionBuilder filters) {
        this.objects = objects;
        this.filters = filters;
    }

    public void store(String project, String uid, String key, String tag, byte[] document) {
        requireKey(key);
        Map<String, Object> keyAttribute = Map.of(AttributeNames.ARTIFACT_NAME, key);
        objects.storeObject(StorePaths.artifact(project, key, uid), document, ArtifactMetadataEnvelope.class, keyAttribute);
        objects.storeObject(StorePaths.artifact(project, key, tagOrDefault(tag)), document, ArtifactMetadataEnvelope.class, keyAttribute);
    }

    /** {@code {"data": <artifact>}}. */
    public byte[] read(String project, String key, String tag) {
        requireKey(key);
        return objects.readWrapped(StorePaths.artifact(project, key, tagOrDefault(tag)));
    }

    public void delete(String project, String key, String tag) {
        requireKey(key);
        objects.delete(StorePaths.artifact(project, key, tagOrDefault(tag)));
    }

    /** {@code {"artifacts": [...]}}; with tag {@code *} both uid and tag records are listed. */
    public byte[] list(ListQuery query) {
        String project = RunService.requireProject(query);
        return objects.list(StorePaths.artifacts(project), filter(query), query.isSort(), query.getLimit(), COLLECTION);
    }

    public int deleteByQuery(ListQuery query) {
        String project = RunService.requireProject(query);
        return objects.deleteMatching(StorePaths.artifacts(project), filter(query));
    }

    private String filter(ListQuery query) {
        String tag = tagOrDefault(query.getTag());
        return filters.artifactFilter(query.getLabels(), query.getName(), ANY_TAG.equals(tag) ? null : tag);
    }

    static String tagOrDefault(String tag) {
        return tag == null || tag.isEmpty() ? DEFAULT_TAG : tag;
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new FormatException("Expecting 'key' parameter");
        }
    }
}
