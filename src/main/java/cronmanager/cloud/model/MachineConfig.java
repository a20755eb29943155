package cronmanager.cloud.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Launch configuration for a machine, in the Machines API wire shape.
 * Stored verbatim (as JSON) on each schedule. Fields the provider adds that
 * this client does not model are dropped on read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MachineConfig(
        @JsonProperty("image") String image,
        @JsonProperty("env") Map<String, String> env,
        @JsonProperty("guest") Guest guest,
        @JsonProperty("restart") Restart restart,
        @JsonProperty("auto_destroy") Boolean autoDestroy,
        @JsonProperty("metadata") Map<String, String> metadata,
        @JsonProperty("init") Init init) {

    /** Ownership marker; the reconciler only touches machines carrying it. */
    public static final String MANAGED_BY_KEY = "managed-by-cron-manager";
    public static final String JOB_ID_KEY = "cron-manager-job-id";
    public static final String SCHEDULE_KEY = "cron-manager-schedule";

    public static final String RESTART_NO = "no";

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Guest(
            @JsonProperty("cpu_kind") String cpuKind,
            @JsonProperty("cpus") int cpus,
            @JsonProperty("memory_mb") int memoryMb) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Restart(
            @JsonProperty("policy") String policy,
            @JsonProperty("max_retries") Integer maxRetries) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Init(
            @JsonProperty("exec") List<String> exec) {
    }

    public MachineConfig withMetadata(Map<String, String> extra) {
        Map<String, String> merged = new HashMap<>();
        if (metadata != null) {
            merged.putAll(metadata);
        }
        merged.putAll(extra);
        return new MachineConfig(image, env, guest, restart, autoDestroy, merged, init);
    }

    /**
     * Makes the machine run {@code command} as its main process, exit when it
     * finishes and never come back.
     */
    public MachineConfig runOnce(List<String> command) {
        return new MachineConfig(image, env, guest, new Restart(RESTART_NO, null), true, metadata,
                new Init(command));
    }
}
