package cronmanager.cloud.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a command executed on a running machine.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecResult(
        @JsonProperty("exit_code") int exitCode,
        @JsonProperty("stdout") String stdout,
        @JsonProperty("stderr") String stderr) {

    public ExecResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }
}
