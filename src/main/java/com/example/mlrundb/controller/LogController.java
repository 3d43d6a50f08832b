package com.example.mlrundb.controller;

import com.example.mlrundb.service.LogService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
public class LogController {

    private final LogService logService;

    public LogController(LogService logService) {
        this.logService = logService;
    }

    @PostMapping("/log/{project}/{uid}")
    public Mono<ResponseEntity<Void>> storeLog(@PathVariable String project, @PathVariable String uid,
                                               @RequestBody(required = false) byte[] body) {
        return Mono.fromRunnable(() -> logService.store(project, uid, body == null ? new byte[0] : body))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    @GetMapping(value = "/log/{project}/{uid}", produces = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public Mono<byte[]> readLog(@PathVariable String project, @PathVariable String uid) {
        return Mono.fromCallable(() -> logService.read(project, uid))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
