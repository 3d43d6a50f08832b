package com.example.mlrundb.controller;

import com.example.mlrundb.service.ArtifactService;
import com.example.mlrundb.service.ListQuery;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@RestController
public class ArtifactController {

    private final ArtifactService artifactService;

    public ArtifactController(ArtifactService artifactService) {
        this.artifactService = artifactService;
    }

    @PostMapping("/artifact/{project}/{uid}")
    public Mono<ResponseEntity<Void>> storeArtifact(@PathVariable String project, @PathVariable String uid,
                                                    @RequestParam(required = false) String key,
                                                    @RequestParam(required = false) String tag,
                                                    @RequestBody(required = false) byte[] body) {
        return Mono.fromRunnable(() -> artifactService.store(project, uid, key, tag, body == null ? new byte[0] : body))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    @GetMapping(value = "/artifact/{project}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<byte[]> readArtifact(@PathVariable String project,
                                     @RequestParam(required = false) String key,
                                     @RequestParam(required = false) String tag) {
        return Mono.fromCallable(() -> artifactService.read(project, key, tag))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/artifact/{project}")
    public Mono<ResponseEntity<Void>> deleteArtifact(@PathVariable String project,
                                                     @RequestParam(required = false) String key,
                                                     @RequestParam(required = false) String tag) {
        return Mono.fromRunnable(() -> artifactService.delete(project, key, tag))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    @GetMapping(value = "/artifacts", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<byte[]> listArtifacts(@RequestParam(required = false) String project,
                                      @RequestParam(required = false) String name,
                                      @RequestParam(required = false) String tag,
                                      @RequestParam(name = "label", required = false) List<String> labels,
                                      @RequestParam(required = false) String last,
                                      @RequestParam(required = false) String sort) {
        return Mono.fromCallable(() -> artifactService.list(ListQuery.builder()
                        .project(project)
                        .name(name)
                        .tag(tag)
                        .labels(labels)
                        .sort(QueryParams.flag(sort))
                        .limit(QueryParams.limit(last, 0))
                        .build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping(value = "/artifacts", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> deleteArtifacts(@RequestParam(required = false) String project,
                                                     @RequestParam(required = false) String name,
                                                     @RequestParam(required = false) String tag,
                                                     @RequestParam(name = "label", required = false) List<String> labels) {
        return Mono.fromCallable(() -> Map.<String, Object>of("deleted", artifactService.deleteByQuery(ListQuery.builder()
                        .project(project)
                        .name(name)
                        .tag(tag)
                        .labels(labels)
                        .build())))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
