package com.example.mlrundb.controller;

import com.example.mlrundb.error.BackendException;
import com.example.mlrundb.error.BatchDeleteException;
import com.example.mlrundb.error.MetadataDbException;
import com.example.mlrundb.error.NotFoundException;
import com.example.mlrundb.error.PatchParseException;
import com.example.mlrundb.service.ListQuery;
import com.example.mlrundb.service.RunService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RunControllerTest {

    @Mock
    private RunService runService;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new RunController(runService))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testStoreRun() {
        // When
        client.post().uri("/run/p/u1")
                .bodyValue("{\"metadata\":{\"name\":\"train\"}}".getBytes(StandardCharsets.UTF_8))
                .exchange()
                .expectStatus().isOk();

        // Then
        verify(runService).store(eq("p"), eq("u1"), aryEq("{\"metadata\":{\"name\":\"train\"}}".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testUpdateRun_BadPatch() {
        // Given
        doThrow(new PatchParseException("Patch must be a JSON object of dot-separated paths"))
                .when(runService).update(eq("p"), eq("u1"), any(byte[].class));

        // When / Then
        client.patch().uri("/run/p/u1")
                .bodyValue("[1]".getBytes(StandardCharsets.UTF_8))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("patch_error");
    }

    @Test
    void testReadRun() {
        // Given
        when(runService.read("p", "u1")).thenReturn("{\"data\":{\"a\":1}}".getBytes(StandardCharsets.UTF_8));

        // When / Then
        client.get().uri("/run/p/u1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.a").isEqualTo(1);
    }

    @Test
    void testReadRun_NotFound() {
        // Given
        when(runService.read("p", "nope")).thenThrow(new NotFoundException("/run/p/nope"));

        // When / Then
        client.get().uri("/run/p/nope")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("not_found")
                .jsonPath("$.message").isEqualTo("Not found: /run/p/nope");
    }

    @Test
    void testDeleteRun() {
        client.delete().uri("/run/p/u1").exchange().expectStatus().isOk();

        verify(runService).delete("p", "u1");
    }

    @Test
    void testListRuns_Defaults() {
        // Given
        ArgumentCaptor<ListQuery> captor = ArgumentCaptor.forClass(ListQuery.class);
        when(runService.list(any(ListQuery.class))).thenReturn("{\"runs\": []}".getBytes(StandardCharsets.UTF_8));

        // When
        client.get().uri("/runs?project=p")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.runs").isArray();

        // Then
        verify(runService).list(captor.capture());
        ListQuery query = captor.getValue();
        assertEquals("p", query.getProject());
        assertEquals(30, query.getLimit());
        assertFalse(query.isSort());
        assertEquals(0, query.getUpdatedAfter());
    }

    @Test
    void testListRuns_AllParameters() {
        // Given
        ArgumentCaptor<ListQuery> captor = ArgumentCaptor.forClass(ListQuery.class);
        when(runService.list(any(ListQuery.class))).thenReturn("{\"runs\": []}".getBytes(StandardCharsets.UTF_8));

        // When
        client.get().uri("/runs?project=p&name=train&state=done&label={a}&label={b}&last=0&sort=true",
                        "owner=jo", "gpu")
                .exchange()
                .expectStatus().isOk();

        // Then
        verify(runService).list(captor.capture());
        ListQuery query = captor.getValue();
        assertEquals("train", query.getName());
        assertEquals("done", query.getState());
        assertEquals(List.of("owner=jo", "gpu"), query.getLabels());
        assertEquals(0, query.getLimit());
        assertTrue(query.isSort());
    }

    @Test
    void testListRuns_BadLimit() {
        client.get().uri("/runs?project=p&last=many")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("format_error");

        verifyNoInteractions(runService);
    }

    @Test
    void testDeleteRuns() {
        // Given
        when(runService.deleteByQuery(any(ListQuery.class))).thenReturn(3);

        // When / Then
        client.delete().uri("/runs?project=p&state=failed")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.deleted").isEqualTo(3);
    }

    @Test
    void testDeleteRuns_PartialFailure() {
        // Given
        Map<String, MetadataDbException> failures = Map.of("/run/p/b", new BackendException(503, "unavailable"));
        when(runService.deleteByQuery(any(ListQuery.class))).thenThrow(new BatchDeleteException(failures, 2));

        // When / Then
        client.delete().uri("/runs?project=p")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("batch_delete_error")
                .jsonPath("$.deleted").isEqualTo(2)
                .jsonPath("$.failed[0]").isEqualTo("/run/p/b");
    }
}
