package io.github.drompincen.payverify.gateway.controller;

import io.github.drompincen.payverify.protocol.api.VerificationDto;
import io.github.drompincen.payverify.protocol.api.VerificationStatusResponse;
import io.github.drompincen.payverify.protocol.api.VerificationSummary;
import io.github.drompincen.payverify.protocol.api.VerificationVerdict;
import io.github.drompincen.payverify.protocol.event.ProgressEvent;
import io.github.drompincen.payverify.runtime.verification.VerificationOrchestrator;
import io.github.drompincen.payverify.runtime.verification.VerificationQueryService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/verification/applications/{applicationId}")
public class VerificationController {

    private final VerificationOrchestrator orchestrator;
    private final VerificationQueryService queryService;

    public VerificationController(VerificationOrchestrator orchestrator,
                                  VerificationQueryService queryService) {
        this.orchestrator = orchestrator;
        this.queryService = queryService;
    }

    @PostMapping("/verify")
    public Mono<VerificationVerdict> verify(@PathVariable String applicationId,
                                            @RequestParam(required = false) String documentId) {
        return orchestrator.verify(applicationId, documentId);
    }

    @GetMapping(value = "/live", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ProgressEvent>> liveVerify(@PathVariable String applicationId,
                                                           @RequestParam(required = false) String documentId) {
        return orchestrator.verifyWithProgress(applicationId, documentId)
                .map(event -> ServerSentEvent.builder(event)
                        .id(String.valueOf(event.seq()))
                        .event(event.step())
                        .build());
    }

    @GetMapping
    public List<VerificationDto> list(@PathVariable String applicationId) {
        return queryService.listForApplication(applicationId);
    }

    @GetMapping("/latest")
    public ResponseEntity<VerificationSummary> latest(@PathVariable String applicationId) {
        return queryService.latestSummary(applicationId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/status")
    public VerificationStatusResponse status(@PathVariable String applicationId) {
        return queryService.status(applicationId);
    }
}
