package cronmanager.coordinator.model;

import cronmanager.cloud.model.MachineConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable domain model of a recurring trigger: a cron expression bound to a
 * command and the machine it runs on. {@code name} is the natural key used by
 * schedule sync; {@code id} is assigned by the store.
 */
public final class Schedule {

    public static final int DEFAULT_COMMAND_TIMEOUT = 30;

    private final long id;
    private final String name;
    private final String appName;
    private final String cronExpression;
    private final String region;
    private final String command;
    private final int commandTimeout;
    private final boolean enabled;
    private final MachineConfig config;

    private Schedule(Builder builder) {
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.appName = Objects.requireNonNull(builder.appName, "appName is required");
        this.cronExpression = Objects.requireNonNull(builder.cronExpression, "cronExpression is required");
        this.region = builder.region;
        this.command = Objects.requireNonNull(builder.command, "command is required");
        this.commandTimeout = builder.commandTimeout > 0 ? builder.commandTimeout : DEFAULT_COMMAND_TIMEOUT;
        this.enabled = builder.enabled;
        this.config = Objects.requireNonNull(builder.config, "config is required");
    }

    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String appName() {
        return appName;
    }

    public String cronExpression() {
        return cronExpression;
    }

    public String region() {
        return region;
    }

    public String command() {
        return command;
    }

    /** Seconds. */
    public int commandTimeout() {
        return commandTimeout;
    }

    public Duration commandTimeoutDuration() {
        return Duration.ofSeconds(commandTimeout);
    }

    public boolean enabled() {
        return enabled;
    }

    public MachineConfig config() {
        return config;
    }

    /** True when everything except the id matches. */
    public boolean sameDefinitionAs(Schedule other) {
        return name.equals(other.name)
                && appName.equals(other.appName)
                && cronExpression.equals(other.cronExpression)
                && Objects.equals(region, other.region)
                && command.equals(other.command)
                && commandTimeout == other.commandTimeout
                && enabled == other.enabled
                && config.equals(other.config);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .appName(appName)
                .cronExpression(cronExpression)
                .region(region)
                .command(command)
                .commandTimeout(commandTimeout)
                .enabled(enabled)
                .config(config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String name;
        private String appName;
        private String cronExpression;
        private String region;
        private String command;
        private int commandTimeout;
        private boolean enabled = true;
        private MachineConfig config;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder appName(String appName) {
            this.appName = appName;
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder commandTimeout(int commandTimeout) {
            this.commandTimeout = commandTimeout;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder config(MachineConfig config) {
            this.config = config;
            return this;
        }

        public Schedule build() {
            return new Schedule(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Schedule schedule))
            return false;
        return id == schedule.id && name.equals(schedule.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "Schedule{id=" + id + ", name='" + name + "', app='" + appName + "', schedule='" + cronExpression
                + "', enabled=" + enabled + "}";
    }
}
