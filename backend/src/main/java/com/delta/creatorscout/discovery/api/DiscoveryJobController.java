package com.delta.creatorscout.discovery.api;

import com.delta.creatorscout.discovery.model.CreatorRecord;
import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.model.DiscoveryJobRequest;
import com.delta.creatorscout.discovery.service.CreatorCsvExporter;
import com.delta.creatorscout.discovery.service.DiscoveryJobService;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/jobs")
public class DiscoveryJobController {
    private final DiscoveryJobService jobService;
    private final CreatorCsvExporter csvExporter;

    public DiscoveryJobController(DiscoveryJobService jobService, CreatorCsvExporter csvExporter) {
        this.jobService = jobService;
        this.csvExporter = csvExporter;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public DiscoveryJob createJob(@RequestBody(required = false) DiscoveryJobRequest request) {
        return jobService.createJob(request);
    }

    @GetMapping("/{jobId}")
    public DiscoveryJob getJob(@PathVariable("jobId") UUID jobId) {
        return jobService.getJob(jobId);
    }

    @GetMapping("/{jobId}/results")
    public List<CreatorRecord> getResults(@PathVariable("jobId") UUID jobId) {
        return jobService.getResults(jobId);
    }

    @GetMapping("/{jobId}/results.csv")
    public void exportResults(@PathVariable("jobId") UUID jobId, HttpServletResponse response) throws IOException {
        DiscoveryJob job = jobService.getJob(jobId);
        List<CreatorRecord> records = jobService.getResults(jobId);
        response.setContentType("text/csv");
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setHeader(
            HttpHeaders.CONTENT_DISPOSITION,
            "attachment; filename=\"creators-" + jobId + ".csv\""
        );
        csvExporter.write(job, records, response.getWriter());
    }
}
