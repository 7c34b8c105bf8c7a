package flowrun.engine.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import flowrun.engine.model.ResourceRequest;
import flowrun.engine.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a task as a local operating-system process.
 *
 * Task arguments:
 * <pre>
 * {
 *   "command":    ["sh", "-c", "echo hello"],
 *   "workingDir": "/tmp/job-1",              (optional)
 *   "resources":  {"cpu": 2, "memMb": 512}   (optional, cpu may be "all")
 * }
 * </pre>
 *
 * Returns {@code {"exitCode": 0, "output": "..."}} with stdout and stderr
 * merged. A non-zero exit code is a failure. Interrupting the calling thread
 * destroys the process.
 */
public class ProcessRunner implements Runner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    static final ResourceRequest DEFAULT_REQUIREMENTS = ResourceRequest.of(1, 0);

    private final Task task;

    public ProcessRunner(Task task) {
        this.task = task;
    }

    @Override
    public Object run() throws Exception {
        List<String> command = command();
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        String workingDir = task.arguments().path("workingDir").asText(null);
        if (workingDir != null && !workingDir.isBlank()) {
            builder.directory(new File(workingDir));
        }

        Path outputFile = Files.createTempFile("flowrun-", ".out");
        builder.redirectOutput(outputFile.toFile());
        try {
            log.debug("Task {} launching {}", task.id(), command);
            Process process;
            try {
                process = builder.start();
            } catch (IOException e) {
                throw new RunnerException("Cannot start " + command.get(0) + " for task " + task.id(), e);
            }

            int exitCode;
            try {
                exitCode = process.waitFor();
            } catch (InterruptedException e) {
                log.warn("Task {} interrupted, stopping {}", task.id(), command.get(0));
                process.destroy();
                throw e;
            }
            String output = Files.readString(outputFile, StandardCharsets.UTF_8);
            return result(command, exitCode, output);
        } finally {
            Files.deleteIfExists(outputFile);
        }
    }

    private ObjectNode result(List<String> command, int exitCode, String output) throws RunnerException {
        if (exitCode != 0) {
            throw new RunnerException("Command " + command + " exited with code " + exitCode + ": " + output.strip());
        }

        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("exitCode", exitCode);
        result.put("output", output);
        return result;
    }

    @Override
    public ResourceRequest getRequirements() {
        JsonNode res = task.arguments().path("resources");
        if (!res.isObject()) {
            return DEFAULT_REQUIREMENTS;
        }
        JsonNode cpuNode = res.path("cpu");
        int memMb = res.path("memMb").asInt(DEFAULT_REQUIREMENTS.memMb());
        if (cpuNode.isTextual() && "all".equalsIgnoreCase(cpuNode.asText())) {
            return ResourceRequest.exclusive(memMb);
        }
        return ResourceRequest.of(cpuNode.asInt(DEFAULT_REQUIREMENTS.cpu()), memMb);
    }

    private List<String> command() throws RunnerException {
        JsonNode node = task.arguments().path("command");
        if (!node.isArray() || node.isEmpty()) {
            throw new RunnerException("Task " + task.id() + " has no command to run");
        }
        List<String> command = new ArrayList<>(node.size());
        node.forEach(part -> command.add(part.asText()));
        return command;
    }
}
