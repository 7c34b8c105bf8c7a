package flowrun.engine.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import flowrun.engine.model.Job;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Outcome of a job and its tasks, for reporting after a run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobReport(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("status") String status,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("failedTaskId") String failedTaskId,
        @JsonProperty("tasks") List<TaskReport> tasks) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Create report from domain model */
    public static JobReport from(Job job) {
        List<TaskReport> tasks = job.graph().tasks().stream()
                .map(TaskReport::from)
                .toList();

        return new JobReport(
                job.id(),
                job.status().name(),
                job.errorMessage(),
                job.failedTaskId(),
                tasks);
    }

    public String toJson() {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialise report for job " + jobId, e);
        }
    }
}
