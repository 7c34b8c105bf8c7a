package flowrun.engine.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import flowrun.engine.model.ResourceRequest;
import flowrun.engine.model.Task;
import flowrun.engine.model.TaskOutcome;

/**
 * Outcome of one task, for reporting after a run.
 * The cpu field is "all" for exclusive requests.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskReport(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("kind") String kind,
        @JsonProperty("appId") String appId,
        @JsonProperty("appType") String appType,
        @JsonProperty("status") String status,
        @JsonProperty("cpu") String cpu,
        @JsonProperty("memMb") Integer memMb,
        @JsonProperty("startedAt") String startedAt,
        @JsonProperty("finishedAt") String finishedAt,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("error") String error) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Create report from domain model */
    public static TaskReport from(Task task) {
        ResourceRequest res = task.resources();
        TaskOutcome outcome = task.outcome();

        JsonNode result = null;
        String error = null;
        if (outcome != null) {
            if (outcome.isSuccess()) {
                result = toJson(outcome.value());
            } else {
                error = outcome.message();
            }
        }

        return new TaskReport(
                task.id(),
                task.kind().name(),
                task.app() != null ? task.app().id() : null,
                task.app() != null ? task.app().type().name() : null,
                task.status().name(),
                res == null ? null : (res.isExclusive() ? "all" : String.valueOf(res.cpu())),
                res == null ? null : res.memMb(),
                task.startedAt() != null ? task.startedAt().toString() : null,
                task.finishedAt() != null ? task.finishedAt().toString() : null,
                result,
                error);
    }

    private static JsonNode toJson(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        try {
            return MAPPER.valueToTree(value);
        } catch (IllegalArgumentException e) {
            // Not a bean Jackson can map
            return TextNode.valueOf(value.toString());
        }
    }
}
