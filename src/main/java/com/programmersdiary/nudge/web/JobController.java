package com.programmersdiary.nudge.web;

import com.programmersdiary.nudge.scheduling.InvalidScheduleException;
import com.programmersdiary.nudge.scheduling.Job;
import com.programmersdiary.nudge.scheduling.JobNotFoundException;
import com.programmersdiary.nudge.scheduling.ProactiveScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private final ProactiveScheduler scheduler;

    public JobController(ProactiveScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping
    public List<JobResponse> listJobs() {
        return scheduler.listJobs().stream()
                .map(JobResponse::from)
                .toList();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public JobResponse addJob(@RequestBody CreateJobRequest request) {
        try {
            var result = scheduler.addJob(request.schedule(), request.instruction(), request.channel(), request.chatId());
            var job = new Job(result.jobId(), request.schedule(), request.instruction(), request.channel(), request.chatId());
            var warning = result.isPersisted()
                    ? null
                    : "Job is active but could not be saved: " + result.persistenceFailure().getMessage();
            return JobResponse.from(job, warning);
        } catch (InvalidScheduleException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeJob(@PathVariable String id) {
        try {
            scheduler.removeJob(id);
        } catch (JobNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }
}
