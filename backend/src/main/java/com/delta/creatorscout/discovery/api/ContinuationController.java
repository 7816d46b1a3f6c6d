package com.delta.creatorscout.discovery.api;

import com.delta.creatorscout.discovery.model.JobAdvanceOutcome;
import com.delta.creatorscout.discovery.service.DiscoveryJobService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound endpoint for externally delivered continuation messages. The body carries only the job id.
 */
@RestController
@RequestMapping("/api/continuations")
public class ContinuationController {
    private final DiscoveryJobService jobService;

    public ContinuationController(DiscoveryJobService jobService) {
        this.jobService = jobService;
    }

    @PostMapping
    public JobAdvanceOutcome deliver(@RequestBody(required = false) ContinuationMessageRequest request) {
        return jobService.handleContinuation(request == null ? null : request.jobId());
    }
}
