package io.dispatch4j.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dispatch4j.core.CronDescriptor;
import io.dispatch4j.cron.CronEngine;
import io.dispatch4j.scheduler.OneShotScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP gateway for creating and cancelling one-shot jobs and replacing the recurring set.
 *
 * <p>The mutating endpoints are guarded by {@link SecretHeaderInterceptor}.
 */
@RestController
public class DispatchController {
    private static final Logger log = LoggerFactory.getLogger(DispatchController.class);

    static final String IDENTIFICATION = "Scheduler (dispatch4j): one-shot and cron callback dispatcher.";

    private final OneShotScheduler scheduler;
    private final CronEngine cronEngine;
    private final ObjectMapper objectMapper;

    public DispatchController(OneShotScheduler scheduler, CronEngine cronEngine, ObjectMapper objectMapper) {
        this.scheduler = scheduler;
        this.cronEngine = cronEngine;
        this.objectMapper = objectMapper;
    }

    public record InsertResponse(String id) {
    }

    public record DeleteRequest(String id) {
    }

    public record CronJobRequest(String id, String spec) {
    }

    public record CronRequest(List<CronJobRequest> jobs) {
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public String root() {
        return IDENTIFICATION;
    }

    @PostMapping("/insert")
    public InsertResponse insert(@RequestBody byte[] raw) throws IOException {
        InsertRequest req = InsertRequest.read(objectMapper.getFactory(), raw);
        String id = scheduler.createJob(req.timestamp(), req.body());
        return new InsertResponse(id);
    }

    @PostMapping("/delete")
    public ResponseEntity<Void> delete(@RequestBody(required = false) DeleteRequest req) {
        if (req == null || req.id() == null || req.id().isBlank()) {
            log.debug("Delete without id ignored");
            return ResponseEntity.ok().build();
        }
        scheduler.cancelJob(req.id());
        return ResponseEntity.ok().build();
    }

    @PostMapping("/cron")
    public ResponseEntity<Void> cron(@RequestBody CronRequest req) {
        List<CronDescriptor> descriptors = new ArrayList<>();
        if (req.jobs() != null) {
            for (CronJobRequest j : req.jobs()) {
                if (j == null || j.id() == null || j.spec() == null) {
                    throw new IllegalArgumentException("every cron job needs an id and a spec");
                }
                descriptors.add(new CronDescriptor(j.id(), j.spec()));
            }
        }
        cronEngine.reconfigure(descriptors);
        return ResponseEntity.ok().build();
    }
}
