package com.programmersdiary.nudge.scheduling;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

public record PersistedState(List<Job> jobs, @JsonProperty("next_id") int nextId) {

    public PersistedState {
        jobs = jobs == null ? List.of() : jobs.stream().filter(Objects::nonNull).toList();
    }
}
