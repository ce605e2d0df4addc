package com.topicmatch.backend.modules.solver.domain;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optimizer input. Groups and students are addressed by their index in {@link #groups()} and
 * {@link #students()}; the index to id maps live on the job, not here.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SolverRequest(
        @JsonProperty("num_students") int numStudents,
        @JsonProperty("num_groups") int numGroups,
        List<Group> groups,
        List<Student> students,
        List<List<Integer>> exclude,
        @JsonProperty("ranking_percentage") Double rankingPercentage,
        @JsonProperty("max_time_in_seconds") Integer maxTimeInSeconds
) {

    public record Group(
            int id,
            int size,
            Map<String, List<Criterion>> criteria
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Criterion(
            String type,
            @JsonProperty("min_ratio") Double minRatio,
            @JsonProperty("min_students") Integer minStudents,
            @JsonProperty("max_students") Integer maxStudents
    ) {
    }

    public record Student(
            int id,
            @JsonProperty("possible_groups") List<Integer> possibleGroups,
            Map<String, Double> values
    ) {
    }
}
