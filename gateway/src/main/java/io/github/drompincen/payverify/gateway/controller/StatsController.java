package io.github.drompincen.payverify.gateway.controller;

import io.github.drompincen.payverify.protocol.api.VerificationStats;
import io.github.drompincen.payverify.runtime.verification.VerificationQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/stats")
public class StatsController {

    private final VerificationQueryService queryService;

    public StatsController(VerificationQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/global")
    public VerificationStats global() {
        return queryService.globalStats();
    }
}
