package com.example.mlrundb.controller;

import com.example.mlrundb.service.ListQuery;
import com.example.mlrundb.service.RunService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
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
public class RunController {

    private final RunService runService;

    @Value("${app.listing.default-run-limit:30}")
    private int defaultRunLimit = 30;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    @PostMapping("/run/{project}/{uid}")
    public Mono<ResponseEntity<Void>> storeRun(@PathVariable String project, @PathVariable String uid,
                                               @RequestBody(required = false) byte[] body) {
        return Mono.fromRunnable(() -> runService.store(project, uid, body == null ? new byte[0] : body))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    @PatchMapping("/run/{project}/{uid}")
    public Mono<ResponseEntity<Void>> updateRun(@PathVariable String project, @PathVariable String uid,
                                                @RequestBody(required = false) byte[] body) {
        return Mono.fromRunnable(() -> runService.update(project, uid, body == null ? new byte[0] : body))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    @GetMapping(value = "/run/{project}/{uid}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<byte[]> readRun(@PathVariable String project, @PathVariable String uid) {
        return Mono.fromCallable(() -> runService.read(project, uid))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/run/{project}/{uid}")
    public Mono<ResponseEntity<Void>> deleteRun(@PathVariable String project, @PathVariable String uid) {
        return Mono.fromRunnable(() -> runService.delete(project, uid))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    @GetMapping(value = "/runs", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<byte[]> listRuns(@RequestParam(required = false) String project,
                                 @RequestParam(required = false) String name,
                                 @RequestParam(required = false) String state,
                                 @RequestParam(name = "label", required = false) List<String> labels,
                                 @RequestParam(required = false) String last,
                                 @RequestParam(required = false) String sort,
                                 @RequestParam(required = false) String since) {
        return Mono.fromCallable(() -> runService.list(ListQuery.builder()
                        .project(project)
                        .name(name)
                        .state(state)
                        .labels(labels)
                        .updatedAfter(QueryParams.timestamp("since", since))
                        .sort(QueryParams.flag(sort))
                        .limit(QueryParams.limit(last, defaultRunLimit))
                        .build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping(value = "/runs", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> deleteRuns(@RequestParam(required = false) String project,
                                                @RequestParam(required = false) String name,
                                                @RequestParam(required = false) String state,
                                                @RequestParam(name = "label", required = false) List<String> labels,
                                                @RequestParam(required = false) String since) {
        return Mono.fromCallable(() -> Map.<String, Object>of("deleted", runService.deleteByQuery(ListQuery.builder()
                        .project(project)
                        .name(name)
                        .state(state)
                        .labels(labels)
                        .updatedAfter(QueryParams.timestamp("since", since))
                        .build())))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
