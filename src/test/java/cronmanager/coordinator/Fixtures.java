package cronmanager.coordinator;

import cronmanager.cloud.model.MachineConfig;
import cronmanager.coordinator.model.Schedule;
import cronmanager.coordinator.model.ScheduleDefinition;

import java.util.Map;

public final class Fixtures {

    private Fixtures() {
    }

    public static String memoryUrl(String name) {
        return "jdbc:h2:mem:" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    public static MachineConfig config() {
        return new MachineConfig("ghcr.io/example/worker:latest", Map.of("MODE", "cron"),
                new MachineConfig.Guest("shared", 1, 256), null, null, null, null);
    }

    public static Schedule schedule(String name) {
        return Schedule.builder()
                .name(name)
                .appName("cron-app")
                .cronExpression("*/5 * * * *")
                .region("ord")
                .command("echo " + name)
                .config(config())
                .build();
    }

    public static ScheduleDefinition definition(String name, String cron, String command, Integer timeout) {
        return new ScheduleDefinition(name, "cron-app", cron, "ord", command, timeout, null, config());
    }
}
