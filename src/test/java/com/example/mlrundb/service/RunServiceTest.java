package com.example.mlrundb.service;

import com.example.mlrundb.codec.DocumentCodec;
import com.example.mlrundb.codec.DocumentFormat;
import com.example.mlrundb.encode.AttributeEncoder;
import com.example.mlrundb.encode.EnvelopeReader;
import com.example.mlrundb.encode.Timestamps;
import com.example.mlrundb.error.BackendException;
import com.example.mlrundb.error.BatchDeleteException;
import com.example.mlrundb.error.FormatException;
import com.example.mlrundb.error.NotFoundException;
import com.example.mlrundb.error.PatchParseException;
import com.example.mlrundb.filter.FilterExpressionBuilder;
import com.example.mlrundb.listing.ListingEngine;
import com.example.mlrundb.patch.MergePatchEngine;
import com.example.mlrundb.store.InMemoryStoreClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private InMemoryStoreClient store;
    private DocumentCodec codec;
    private RunService runService;

    @BeforeEach
    void setUp() {
        store = new InMemoryStoreClient();
        codec = new DocumentCodec();
        EnvelopeReader envelopes = new EnvelopeReader();
        AttributeEncoder encoder = new AttributeEncoder();
        MetadataObjectStore objects = new MetadataObjectStore(store, codec, envelopes, encoder, new ListingEngine());
        runService = new RunService(objects, store, codec, envelopes, encoder, new MergePatchEngine(), new FilterExpressionBuilder());
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String run(String name, String state, int second) {
        return String.format("{\"metadata\":{\"name\":\"%s\",\"labels\":{\"owner\":\"jo\"}},"
                + "\"status\":{\"state\":\"%s\",\"last_update\":\"2020-01-01 00:00:%02d.000000\"}}", name, state, second);
    }

    @Test
    void testStoreAndRead() {
        // Given
        String document = run("train", "running", 1);

        // When
        runService.store("p", "u1", bytes(document));

        // Then
        assertEquals("{\"data\":" + document + "}", new String(runService.read("p", "u1"), StandardCharsets.UTF_8));
        Map<String, Object> attributes = store.attributes("/run/p/u1");
        assertEquals("train", attributes.get("metadata_name"));
        assertEquals("jo", attributes.get("metadata_labels_owner"));
        assertEquals("u1", attributes.get("__name"));
        assertTrue(attributes.containsKey("status_lasttimeEpoch"));
    }

    @Test
    void testStore_ReplacesAttributes() {
        // Given
        runService.store("p", "u1", bytes(run("train", "running", 1)));

        // When
        runService.store("p", "u1", bytes("{\"metadata\":{\"name\":\"train\"}}"));

        // Then
        assertFalse(store.attributes("/run/p/u1").containsKey("metadata_labels_owner"));
        assertFalse(store.attributes("/run/p/u1").containsKey("status_state"));
    }

    @Test
    void testStore_RejectsEmptyAndMalformed() {
        assertThrows(FormatException.class, () -> runService.store("p", "u1", new byte[0]));
        assertThrows(FormatException.class, () -> runService.store("p", "u1", bytes("[1]")));
        assertThrows(FormatException.class, () -> runService.store("p", "u1", bytes("---\na: [1\n")));
        assertFalse(store.contains("/run/p/u1"));
    }

    @Test
    void testRead_Missing() {
        assertThrows(NotFoundException.class, () -> runService.read("p", "nope"));
    }

    @Test
    void testUpdate_Json() throws Exception {
        // Given
        runService.store("p", "u1", bytes(run("train", "running", 1)));

        // When
        runService.update("p", "u1", bytes("{\"status.state\":\"completed\",\"status.results.acc\":0.9}"));

        // Then
        JsonNode data = mapper.readTree(runService.read("p", "u1")).get("data");
        assertEquals("completed", data.at("/status/state").asText());
        assertEquals(0.9, data.at("/status/results/acc").asDouble());
        assertEquals("train", data.at("/metadata/name").asText());
        assertEquals("completed", store.attributes("/run/p/u1").get("status_state"));
    }

    @Test
    void testUpdate_YamlStaysYaml() {
        // Given
        runService.store("p", "u1", bytes("---\nmetadata:\n  name: train\nstatus:\n  state: running\n"));

        // When
        runService.update("p", "u1", bytes("{\"status.state\": \"completed\"}"));

        // Then
        byte[] stored = (byte[]) store.attributes("/run/p/u1").get("_data_");
        assertEquals(DocumentFormat.YAML, codec.detect(stored));
        assertEquals("completed", codec.readTree(stored).at("/status/state").asText());
        assertEquals("train", store.attributes("/run/p/u1").get("metadata_name"));
    }

    @Test
    void testUpdate_ReindexFromMergedDropsStaleAttributes() {
        // Given
        runService.store("p", "u1", bytes("{\"metadata\":{\"name\":\"a\",\"labels\":{\"x\":\"1\"}}}"));

        // When
        runService.update("p", "u1", bytes("{\"metadata.labels\":{\"y\":\"2\"}}"));

        // Then
        Map<String, Object> attributes = store.attributes("/run/p/u1");
        assertFalse(attributes.containsKey("metadata_labels_x"));
        assertEquals("2", attributes.get("metadata_labels_y"));
        assertEquals("a", attributes.get("metadata_name"));
    }

    @Test
    void testUpdate_PatchOnlyIndexing() {
        // Given
        ReflectionTestUtils.setField(runService, "reindexFromMerged", false);
        runService.store("p", "u1", bytes("{\"metadata\":{\"name\":\"a\",\"labels\":{\"x\":\"1\"}}}"));

        // When
        runService.update("p", "u1", bytes("{\"metadata.labels\":{\"y\":\"2\"}}"));

        // Then
        Map<String, Object> attributes = store.attributes("/run/p/u1");
        assertEquals("1", attributes.get("metadata_labels_x"));
        assertEquals("2", attributes.get("metadata_labels_y"));
        assertEquals("a", attributes.get("metadata_name"));
    }

    @Test
    void testUpdate_ObjectLabelValueIsStoredNotIndexed() {
        // Given
        runService.store("p", "u1", bytes("{\"metadata\":{\"name\":\"a\"},\"status\":{\"state\":\"running\"}}"));

        // When
        runService.update("p", "u1", bytes("{\"metadata.labels.owner\":{\"team\":\"x\"}}"));

        // Then
        Map<String, Object> attributes = store.attributes("/run/p/u1");
        assertFalse(attributes.containsKey("metadata_labels_owner"));
        assertEquals("a", attributes.get("metadata_name"));
        assertEquals("running", attributes.get("status_state"));
        byte[] stored = (byte[]) attributes.get("_data_");
        assertEquals("x", codec.readTree(stored).at("/metadata/labels/owner/team").asText());
    }

    @Test
    void testUpdate_ScalarStatusReplacesSection() {
        // Given
        runService.store("p", "u1", bytes("{\"metadata\":{\"name\":\"a\"},\"status\":{\"state\":\"running\"}}"));

        // When
        runService.update("p", "u1", bytes("{\"status\":\"done\"}"));

        // Then
        Map<String, Object> attributes = store.attributes("/run/p/u1");
        assertFalse(attributes.containsKey("status_state"));
        assertEquals("a", attributes.get("metadata_name"));
        byte[] stored = (byte[]) attributes.get("_data_");
        assertEquals("done", codec.readTree(stored).get("status").asText());
    }

    @Test
    void testUpdate_TextIterationIsStoredNotIndexed() {
        // Given
        runService.store("p", "u1", bytes("{\"metadata\":{\"name\":\"a\",\"iteration\":2}}"));

        // When
        runService.update("p", "u1", bytes("{\"metadata.iteration\":\"first\"}"));

        // Then
        Map<String, Object> attributes = store.attributes("/run/p/u1");
        assertFalse(attributes.containsKey("metadata_iteration"));
        assertEquals("a", attributes.get("metadata_name"));
        byte[] stored = (byte[]) attributes.get("_data_");
        assertEquals("first", codec.readTree(stored).at("/metadata/iteration").asText());
    }

    @Test
    void testUpdate_PatchOnlyIndexingWithMisfitValue() {
        // Given
        ReflectionTestUtils.setField(runService, "reindexFromMerged", false);
        runService.store("p", "u1", bytes("{\"metadata\":{\"name\":\"a\"},\"status\":{\"state\":\"running\"}}"));

        // When
        runService.update("p", "u1", bytes("{\"status\":\"done\",\"metadata.labels.owner\":\"jo\"}"));

        // Then
        Map<String, Object> attributes = store.attributes("/run/p/u1");
        assertEquals("jo", attributes.get("metadata_labels_owner"));
        assertEquals("a", attributes.get("metadata_name"));
        byte[] stored = (byte[]) attributes.get("_data_");
        assertEquals("done", codec.readTree(stored).get("status").asText());
    }

    @Test
    void testUpdate_MissingRunAndBadPatch() {
        assertThrows(NotFoundException.class, () -> runService.update("p", "nope", bytes("{\"a\":1}")));

        runService.store("p", "u1", bytes(run("train", "running", 1)));
        assertThrows(PatchParseException.class, () -> runService.update("p", "u1", bytes("[\"a\"]")));
    }

    @Test
    void testList_MostRecentFirst() {
        // Given
        for (int second : new int[]{10, 50, 30, 20, 40}) {
            runService.store("p", "u" + second, bytes(run("r" + second, "done", second)));
        }

        // When
        byte[] result = runService.list(ListQuery.builder().project("p").sort(true).limit(3).build());

        // Then
        assertEquals("{\"runs\": [" + run("r50", "done", 50) + "," + run("r40", "done", 40) + ","
                + run("r30", "done", 30) + "]}", new String(result, StandardCharsets.UTF_8));
    }

    @Test
    void testList_UnknownProject() {
        assertEquals("{\"runs\": []}",
                new String(runService.list(ListQuery.builder().project("nobody").build()), StandardCharsets.UTF_8));
    }

    @Test
    void testList_RequiresProject() {
        assertThrows(FormatException.class, () -> runService.list(ListQuery.builder().build()));
    }

    @Test
    void testList_Filters() throws Exception {
        // Given
        runService.store("p", "u1", bytes(run("train", "done", 10)));
        runService.store("p", "u2", bytes(run("train", "failed", 20)));
        runService.store("p", "u3", bytes("{\"metadata\":{\"name\":\"serve\"},\"status\":{\"state\":\"done\"}}"));
        long after = Timestamps.toEpochNanos("2020-01-01 00:00:15.000000").getAsLong();

        // When
        JsonNode byName = mapper.readTree(runService.list(ListQuery.builder().project("p").name("train").build()));
        JsonNode byLabel = mapper.readTree(runService.list(ListQuery.builder().project("p").labels(List.of("owner=jo")).build()));
        JsonNode byState = mapper.readTree(runService.list(ListQuery.builder().project("p").state("done").build()));
        JsonNode since = mapper.readTree(runService.list(ListQuery.builder().project("p").updatedAfter(after).build()));

        // Then
        assertEquals(2, byName.get("runs").size());
        assertEquals(2, byLabel.get("runs").size());
        assertEquals(2, byState.get("runs").size());
        assertEquals(1, since.get("runs").size());
        assertEquals("failed", since.at("/runs/0/status/state").asText());
    }

    @Test
    void testDeleteByQuery() {
        // Given
        runService.store("p", "a", bytes(run("x", "failed", 1)));
        runService.store("p", "b", bytes(run("y", "failed", 2)));
        runService.store("p", "c", bytes(run("z", "done", 3)));

        // When
        int deleted = runService.deleteByQuery(ListQuery.builder().project("p").state("failed").build());

        // Then
        assertEquals(2, deleted);
        assertFalse(store.contains("/run/p/a"));
        assertFalse(store.contains("/run/p/b"));
        assertTrue(store.contains("/run/p/c"));
        assertEquals(0, runService.deleteByQuery(ListQuery.builder().project("other").build()));
    }

    @Test
    void testDeleteByQuery_ContinuesPastFailures() {
        // Given
        runService.store("p", "a", bytes(run("x", "failed", 1)));
        runService.store("p", "b", bytes(run("y", "failed", 2)));
        runService.store("p", "c", bytes(run("z", "failed", 3)));
        store.failDeletesOf("/run/p/b", new BackendException(503, "unavailable"));

        // When
        BatchDeleteException ex = assertThrows(BatchDeleteException.class,
                () -> runService.deleteByQuery(ListQuery.builder().project("p").build()));

        // Then
        assertEquals(503, ex.getStatusCode());
        assertEquals(2, ex.getDeleted());
        assertEquals(List.of("/run/p/b"), List.copyOf(ex.getFailures().keySet()));
        assertFalse(store.contains("/run/p/a"));
        assertTrue(store.contains("/run/p/b"));
        assertFalse(store.contains("/run/p/c"));
    }

    @Test
    void testDelete() {
        runService.store("p", "u1", bytes(run("train", "running", 1)));

        runService.delete("p", "u1");

        assertFalse(store.contains("/run/p/u1"));
        assertThrows(NotFoundException.class, () -> runService.delete("p", "u1"));
    }
}
