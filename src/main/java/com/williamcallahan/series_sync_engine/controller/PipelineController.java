/**
 * REST controller for the discovery request path and pipeline operations
 *
 * @author William Callahan
 *
 * Features:
 * - Accepts user search terms and reports the coarse discovery status
 * - Queue depth and worker liveness for dashboards
 * - Recent terminal failures per queue for auditing
 * - Manual trigger for the master sync tick
 */

package com.williamcallahan.series_sync_engine.controller;

import com.williamcallahan.series_sync_engine.dto.DiscoveryResponse;
import com.williamcallahan.series_sync_engine.dto.FailedJobResponse;
import com.williamcallahan.series_sync_engine.dto.PipelineStatusResponse;
import com.williamcallahan.series_sync_engine.queue.JobQueue;
import com.williamcallahan.series_sync_engine.queue.QueueCounts;
import com.williamcallahan.series_sync_engine.queue.QueueName;
import com.williamcallahan.series_sync_engine.scheduler.MasterSyncScheduler;
import com.williamcallahan.series_sync_engine.service.DiscoveryRequestService;
import com.williamcallahan.series_sync_engine.service.PipelineHealthGate;
import com.williamcallahan.series_sync_engine.types.DiscoveryStatus;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api")
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);
    private static final int MAX_FAILURES = 100;

    private final DiscoveryRequestService discoveryRequestService;
    private final PipelineHealthGate healthGate;
    private final JobQueue jobQueue;
    private final MasterSyncScheduler masterSyncScheduler;

    public PipelineController(DiscoveryRequestService discoveryRequestService,
                              PipelineHealthGate healthGate,
                              JobQueue jobQueue,
                              MasterSyncScheduler masterSyncScheduler) {
        this.discoveryRequestService = discoveryRequestService;
        this.healthGate = healthGate;
        this.jobQueue = jobQueue;
        this.masterSyncScheduler = masterSyncScheduler;
    }

    /**
     * Requests discovery for a search term. Never fails because of pipeline state;
     * unavailability is reported in the body.
     *
     * @param query user search term
     * @return 400 for rejected queries, 202 when a job was enqueued, 200 otherwise
     */
    @PostMapping("/discovery")
    public ResponseEntity<DiscoveryResponse> requestDiscovery(@RequestParam(name = "q", required = false) String query,
                                                              HttpServletRequest request) {
        DiscoveryResponse response = discoveryRequestService.requestDiscovery(query, clientKey(request));
        if (response.status() == DiscoveryStatus.INVALID) {
            return ResponseEntity.badRequest().body(response);
        }
        if (response.status() == DiscoveryStatus.RESOLVING) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/pipeline/status")
    public PipelineStatusResponse status() {
        Map<String, QueueCounts> queues = new LinkedHashMap<>();
        for (QueueName queue : QueueName.values()) {
            try {
                queues.put(queue.getKey(), jobQueue.counts(queue));
            } catch (RuntimeException e) {
                logger.warn("Could not read counts for queue {}: {}", queue.getKey(), e.getMessage());
            }
        }
        boolean workersOnline = healthGate.areWorkersOnline();
        boolean accepting = workersOnline && healthGate.isQueueHealthy(QueueName.CHECK_SOURCE);
        return new PipelineStatusResponse(workersOnline, accepting, queues);
    }

    @GetMapping("/pipeline/queues/{queue}/failures")
    public ResponseEntity<List<FailedJobResponse>> recentFailures(@PathVariable("queue") String queue,
                                                                  @RequestParam(name = "limit", defaultValue = "20") int limit) {
        Optional<QueueName> queueName = QueueName.fromKey(queue);
        if (queueName.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        int boundedLimit = Math.max(1, Math.min(limit, MAX_FAILURES));
        List<FailedJobResponse> failures = jobQueue.recentFailures(queueName.get(), boundedLimit).stream()
            .map(FailedJobResponse::from)
            .toList();
        return ResponseEntity.ok(failures);
    }

    @PostMapping("/pipeline/sync/run")
    public MasterSyncScheduler.TickSummary runSyncTick() {
        logger.info("Manual master sync tick requested");
        return masterSyncScheduler.runOnce();
    }

    private static String clientKey(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
