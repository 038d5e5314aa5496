package com.programmersdiary.nudge.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.programmersdiary.nudge.scheduling.Job;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(String id, String schedule, String instruction, String channel, String chatId,
                          String warning) {

    static JobResponse from(Job job) {
        return from(job, null);
    }

    static JobResponse from(Job job, String warning) {
        return new JobResponse(job.id(), job.schedule(), job.instruction(), job.channel(), job.chatId(), warning);
    }
}
