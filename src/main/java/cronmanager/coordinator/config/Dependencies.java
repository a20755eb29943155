package cronmanager.coordinator.config;

import cronmanager.cloud.MachineClientFactory;
import cronmanager.cloud.auth.AuthService;
import cronmanager.cloud.flaps.FlapsClientFactory;
import cronmanager.coordinator.api.command.JobTriggerController;
import cronmanager.coordinator.api.v1.HealthController;
import cronmanager.coordinator.api.v1.JobController;
import cronmanager.coordinator.api.v1.ScheduleController;
import cronmanager.coordinator.repository.JobRepository;
import cronmanager.coordinator.repository.ScheduleRepository;
import cronmanager.coordinator.scheduler.JobEvaluator;
import cronmanager.coordinator.scheduler.JobMonitor;
import cronmanager.coordinator.scheduler.Reconciler;
import cronmanager.coordinator.scheduler.Scheduler;
import cronmanager.coordinator.server.ManagerNettyServer;
import cronmanager.coordinator.server.RouterHandler;
import cronmanager.coordinator.service.CrontabInstaller;
import cronmanager.coordinator.service.CrontabSync;
import cronmanager.coordinator.service.JobProcessor;
import cronmanager.coordinator.service.JobService;
import cronmanager.coordinator.service.ScheduleService;
import cronmanager.coordinator.service.ScheduleSync;
import cronmanager.coordinator.store.Database;
import cronmanager.coordinator.store.JdbcJobRepository;
import cronmanager.coordinator.store.JdbcScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.function.Supplier;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * The machine client factory is built on first use, so store-only commands
 * (listing schedules, showing a job) work without the provider credential.
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(ManagerConfig.load())) {
 *     deps.requireMachineCredentials();
 *     deps.reconciler().reconcile();
 *     deps.startScheduler();
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final ManagerConfig config;
    private final Supplier<MachineClientFactory> clientFactorySupplier;
    private final Database database;
    private final ScheduleRepository scheduleRepository;
    private final JobRepository jobRepository;
    private final JobProcessor jobProcessor;
    private final ScheduleSync scheduleSync;
    private final CrontabSync crontabSync;
    private final ScheduleService scheduleService;
    private final JobService jobService;
    private final Reconciler reconciler;
    private final MachineClientFactory machines;
    private final Clock clock;

    private MachineClientFactory clientFactory;
    private JobMonitor jobMonitor;
    private Scheduler scheduler;
    private RouterHandler routerHandler;
    private ManagerNettyServer server;
    private boolean closed;

    private Dependencies(ManagerConfig config, Supplier<MachineClientFactory> clientFactorySupplier,
            CrontabInstaller crontabInstaller, Clock clock) {
        this.config = config;
        this.clientFactorySupplier = clientFactorySupplier;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.scheduleRepository = new JdbcScheduleRepository(database);
        this.jobRepository = new JdbcJobRepository(database);

        // Machines are resolved per call so the credential is only needed when used
        MachineClientFactory machines = appName -> machineClientFactory().forApp(appName);

        // Services
        this.jobProcessor = new JobProcessor(scheduleRepository, jobRepository, machines, config);
        this.scheduleSync = new ScheduleSync(scheduleRepository);
        this.crontabSync = new CrontabSync(scheduleRepository, Path.of(config.crontabPath()),
                config.triggerExecutable(), crontabInstaller);
        this.scheduleService = new ScheduleService(scheduleRepository, crontabSync);
        this.jobService = new JobService(scheduleRepository, jobRepository, jobProcessor);
        this.reconciler = new Reconciler(scheduleRepository, jobRepository, machines, clock);
        this.clock = clock;
        this.machines = machines;

        log.info("Dependencies initialized successfully");
    }

    /**
     * Production wiring: Fly Machines API, system crontab, system clock.
     */
    public static Dependencies create(ManagerConfig config) {
        Supplier<MachineClientFactory> flaps = () -> new FlapsClientFactory(
                AuthService.fromEnv(config.apiTokenEnv()),
                config.machinesApiUrl(),
                config.providerRequestTimeout());
        return new Dependencies(config, flaps, CrontabInstaller.system(), Clock.systemUTC());
    }

    /**
     * Wiring with substitutes for the external collaborators.
     */
    public static Dependencies create(ManagerConfig config, MachineClientFactory clientFactory,
            CrontabInstaller crontabInstaller, Clock clock) {
        return new Dependencies(config, () -> clientFactory, crontabInstaller, clock);
    }

    // Getters
    public ManagerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public ScheduleRepository scheduleRepository() {
        return scheduleRepository;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public JobProcessor jobProcessor() {
        return jobProcessor;
    }

    public ScheduleSync scheduleSync() {
        return scheduleSync;
    }

    public CrontabSync crontabSync() {
        return crontabSync;
    }

    public ScheduleService scheduleService() {
        return scheduleService;
    }

    public JobService jobService() {
        return jobService;
    }

    public Reconciler reconciler() {
        return reconciler;
    }

    /**
     * @throws IllegalStateException if the provider credential is missing
     */
    public synchronized MachineClientFactory machineClientFactory() {
        if (clientFactory == null) {
            clientFactory = clientFactorySupplier.get();
        }
        return clientFactory;
    }

    /**
     * Fail fast when the provider credential is missing.
     */
    public void requireMachineCredentials() {
        machineClientFactory();
    }

    public synchronized JobMonitor jobMonitor() {
        if (jobMonitor == null) {
            JobEvaluator evaluator = new JobEvaluator(scheduleRepository, jobRepository, machines, clock);
            jobMonitor = new JobMonitor(jobRepository, evaluator, config.monitorConcurrency());
        }
        return jobMonitor;
    }

    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(jobMonitor(), config);
        }
        return scheduler;
    }

    public void startScheduler() {
        scheduler().start();
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new JobTriggerController(jobService))
                    .registerController(new ScheduleController(scheduleService, jobService))
                    .registerController(new JobController(jobService))
                    .registerController(new HealthController(database, crontabSync.crontabPath()));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public synchronized ManagerNettyServer server() {
        if (server == null) {
            server = new ManagerNettyServer(routerHandler());
        }
        return server;
    }

    public void startServer() {
        server().start(config.serverHost(), config.serverPort());
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("Closing dependencies...");

        if (server != null) {
            try {
                server.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping API server: {}", e.getMessage());
            }
        }

        // Stop scheduler before its monitor's worker pool
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }
        if (jobMonitor != null) {
            jobMonitor.close();
        }

        try {
            database.close();
        } catch (RuntimeException e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
