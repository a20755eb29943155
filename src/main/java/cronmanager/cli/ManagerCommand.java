package cronmanager.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import cronmanager.coordinator.api.v1.dto.JobResponse;
import cronmanager.coordinator.api.v1.dto.ScheduleResponse;
import cronmanager.coordinator.config.Dependencies;
import cronmanager.coordinator.config.ManagerConfig;
import cronmanager.coordinator.model.Job;
import cronmanager.coordinator.model.ScheduleDefinition;
import cronmanager.coordinator.scheduler.Reconciler;
import cronmanager.coordinator.service.CrontabSyncException;
import cronmanager.coordinator.service.JobExecutionException;
import cronmanager.coordinator.service.JobService;
import cronmanager.coordinator.service.ScheduleFileException;
import cronmanager.coordinator.service.ScheduleSync;
import cronmanager.coordinator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "cm",
        mixinStandardHelpOptions = true,
        description = "Runs commands on schedule in short-lived Fly Machines",
        subcommands = {
                ManagerCommand.StartCommand.class,
                ManagerCommand.MonitorCommand.class,
                ManagerCommand.ApiCommand.class,
                ManagerCommand.SchedulesCommand.class,
                ManagerCommand.JobsCommand.class
        }
)
public final class ManagerCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ManagerCommand.class);

    @Option(names = {"--config"}, description = "INI config file (default: $CRON_MANAGER_CONFIG or /etc/cron-manager/cron-manager.ini)")
    File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    /**
     * Command line whose failures print one line to stderr and exit 1.
     */
    public static CommandLine newCommandLine() {
        return new CommandLine(new ManagerCommand())
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    cmd.getErr().println("Error: " + e.getMessage());
                    return 1;
                });
    }

    ManagerConfig config() {
        return ManagerConfig.load(configFile);
    }

    Dependencies dependencies() {
        return Dependencies.create(config());
    }

    static void printJson(Object value) {
        try {
            System.out.println(Json.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render output: " + e.getMessage(), e);
        }
    }

    /**
     * Blocks the calling thread until {@code awaiter} returns. A JVM shutdown
     * stops {@code deps} and waits for the command to finish closing them.
     */
    static int runUntilShutdown(Dependencies deps, Awaiter awaiter) throws Exception {
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            try {
                finished.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "cron-manager-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            awaiter.await();
            return 0;
        } finally {
            finished.countDown();
        }
    }

    @FunctionalInterface
    interface Awaiter {
        void await() throws Exception;
    }

    @Command(name = "start", description = "Sync schedules, reconcile, then run the monitor and the HTTP API")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        ManagerCommand parent;

        @Option(names = {"--schedules-file"}, description = "Schedules file to sync on boot (default from config)")
        Path schedulesFile;

        @Option(names = {"--no-server"}, description = "Do not start the HTTP API")
        boolean noServer;

        @Override
        public Integer call() throws Exception {
            try (Dependencies deps = parent.dependencies()) {
                deps.requireMachineCredentials();

                Path file = schedulesFile != null ? schedulesFile : Path.of(deps.config().schedulesFile());
                try {
                    ScheduleSync.Result result = deps.scheduleSync().sync(file);
                    log.info("Schedules synced from {}: {}", file, result);
                } catch (ScheduleFileException e) {
                    log.warn("Schedules file {} not applied: {}", file, e.getMessage());
                }

                try {
                    int installed = deps.crontabSync().sync();
                    log.info("Crontab installed with {} entries", installed);
                } catch (CrontabSyncException e) {
                    log.warn("Crontab not installed: {}", e.getMessage());
                }

                Reconciler.Report report = deps.reconciler().reconcile();
                log.info("Startup reconciliation: {}", report);

                if (!noServer) {
                    deps.startServer();
                }
                deps.startScheduler();
                return runUntilShutdown(deps, () -> deps.scheduler().awaitTermination());
            }
        }
    }

    @Command(name = "monitor", description = "Run only the job monitor loop")
    static final class MonitorCommand implements Callable<Integer> {
        @ParentCommand
        ManagerCommand parent;

        @Override
        public Integer call() throws Exception {
            try (Dependencies deps = parent.dependencies()) {
                deps.requireMachineCredentials();
                deps.startScheduler();
                return runUntilShutdown(deps, () -> deps.scheduler().awaitTermination());
            }
        }
    }

    @Command(name = "api", description = "Run only the HTTP API")
    static final class ApiCommand implements Callable<Integer> {
        @ParentCommand
        ManagerCommand parent;

        @Option(names = {"--port"}, description = "Listen port (default from config)")
        Integer port;

        @Override
        public Integer call() throws Exception {
            ManagerConfig config = parent.config();
            if (port != null) {
                config.withServerPort(port);
            }
            try (Dependencies deps = Dependencies.create(config)) {
                deps.requireMachineCredentials();
                deps.startServer();
                return runUntilShutdown(deps, () -> deps.server().awaitClose());
            }
        }
    }

    @Command(
            name = "schedules",
            description = "Manage schedules",
            subcommands = {
                    SchedulesListCommand.class,
                    SchedulesSyncCommand.class,
                    SchedulesCreateCommand.class,
                    SchedulesDeleteCommand.class
            }
    )
    static final class SchedulesCommand implements Runnable {
        @ParentCommand
        ManagerCommand parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public void run() {
            spec.commandLine().usage(System.out);
        }
    }

    @Command(name = "list", description = "List schedules")
    static final class SchedulesListCommand implements Callable<Integer> {
        @ParentCommand
        SchedulesCommand group;

        @Override
        public Integer call() {
            try (Dependencies deps = group.parent.dependencies()) {
                printJson(deps.scheduleService().list().stream().map(ScheduleResponse::from).toList());
                return 0;
            }
        }
    }

    @Command(name = "sync", description = "Make the store match a schedules file, then reinstall the crontab")
    static final class SchedulesSyncCommand implements Callable<Integer> {
        @ParentCommand
        SchedulesCommand group;

        @Option(names = {"--file"}, description = "Schedules file (default from config)")
        Path file;

        @Option(names = {"--skip-crontab"}, description = "Only update the store")
        boolean skipCrontab;

        @Override
        public Integer call() {
            try (Dependencies deps = group.parent.dependencies()) {
                Path source = file != null ? file : Path.of(deps.config().schedulesFile());
                ScheduleSync.Result result = deps.scheduleSync().sync(source);
                printJson(result);
                if (!skipCrontab) {
                    deps.crontabSync().sync();
                }
                return 0;
            }
        }
    }

    @Command(name = "create", description = "Create one schedule from a JSON definition")
    static final class SchedulesCreateCommand implements Callable<Integer> {
        @ParentCommand
        SchedulesCommand group;

        @Option(names = {"--file"}, required = true, description = "JSON file holding one schedule definition")
        Path file;

        @Override
        public Integer call() throws IOException {
            ScheduleDefinition definition = Json.mapper().readValue(file.toFile(), ScheduleDefinition.class);
            try (Dependencies deps = group.parent.dependencies()) {
                printJson(ScheduleResponse.from(deps.scheduleService().create(definition)));
                return 0;
            }
        }
    }

    @Command(name = "delete", description = "Delete a schedule and its job history")
    static final class SchedulesDeleteCommand implements Callable<Integer> {
        @ParentCommand
        SchedulesCommand group;

        @Parameters(index = "0", arity = "0..1", description = "Schedule id")
        Long id;

        @Option(names = {"--name"}, description = "Schedule name, instead of the id")
        String name;

        @Override
        public Integer call() {
            if ((id == null) == (name == null)) {
                throw new CommandLine.ParameterException(group.spec.commandLine(),
                        "Pass either a schedule id or --name");
            }
            try (Dependencies deps = group.parent.dependencies()) {
                if (id != null) {
                    deps.scheduleService().delete(id);
                    System.out.println("Deleted schedule " + id);
                } else {
                    deps.scheduleService().deleteByName(name);
                    System.out.println("Deleted schedule " + name);
                }
                return 0;
            }
        }
    }

    @Command(
            name = "jobs",
            description = "Inspect and trigger jobs",
            subcommands = {
                    JobsListCommand.class,
                    JobsShowCommand.class,
                    JobsTriggerCommand.class
            }
    )
    static final class JobsCommand implements Runnable {
        @ParentCommand
        ManagerCommand parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public void run() {
            spec.commandLine().usage(System.out);
        }
    }

    @Command(name = "list", description = "Most recent jobs of a schedule")
    static final class JobsListCommand implements Callable<Integer> {
        @ParentCommand
        JobsCommand group;

        @Parameters(index = "0", description = "Schedule id")
        long scheduleId;

        @Option(names = {"--limit"}, description = "Number of jobs (default: ${DEFAULT-VALUE})")
        int limit = JobService.DEFAULT_LIST_LIMIT;

        @Override
        public Integer call() {
            try (Dependencies deps = group.parent.dependencies()) {
                List<Job> jobs = deps.jobService().listForSchedule(scheduleId, limit);
                printJson(jobs.stream().map(job -> JobResponse.from(job).compact()).toList());
                return 0;
            }
        }
    }

    @Command(name = "show", description = "Show one job, including its output")
    static final class JobsShowCommand implements Callable<Integer> {
        @ParentCommand
        JobsCommand group;

        @Parameters(index = "0", description = "Job id")
        long jobId;

        @Override
        public Integer call() {
            try (Dependencies deps = group.parent.dependencies()) {
                printJson(JobResponse.from(deps.jobService().get(jobId)));
                return 0;
            }
        }
    }

    /**
     * Entry point of the crontab lines: runs one job of a schedule to completion.
     */
    @Command(name = "trigger", description = "Run a job of a schedule now and wait for it")
    static final class JobsTriggerCommand implements Callable<Integer> {
        @ParentCommand
        JobsCommand group;

        @Parameters(index = "0", description = "Schedule id")
        long scheduleId;

        @Override
        public Integer call() {
            try (Dependencies deps = group.parent.dependencies()) {
                deps.requireMachineCredentials();
                try {
                    printJson(JobResponse.from(deps.jobService().trigger(scheduleId)));
                    return 0;
                } catch (JobExecutionException e) {
                    System.err.println("Job " + e.jobId() + " failed: " + e.getMessage());
                    return 1;
                }
            }
        }
    }
}
