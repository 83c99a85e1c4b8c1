package com.gamedrops.service;

import com.gamedrops.core.bus.EventBus;
import com.gamedrops.core.model.TickReport;
import com.gamedrops.dispatcher.api.DispatchContext;
import com.gamedrops.dispatcher.config.DispatcherSettings;
import com.gamedrops.dispatcher.dispatch.HttpJobTrigger;
import com.gamedrops.dispatcher.tick.TickRunner;
import com.gamedrops.dispatcher.window.Schedule;
import com.gamedrops.dispatcher.window.WindowMatcher;
import com.gamedrops.dispatcher.window.WindowRule;
import com.gamedrops.service.config.ConfigLoader;
import com.gamedrops.service.http.HttpClientFactory;
import com.gamedrops.service.runtime.SchedulerService;
import com.gamedrops.service.runtime.TickLogger;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final String USAGE = String.join(System.lineSeparator(),
            "usage: gamedrops-scheduler [once | run <group>]",
            "  (no command)  fire a tick at every UTC minute until stopped",
            "  once          run a single tick for the current minute and exit",
            "  run <group>   dispatch one job group immediately"
    );

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Command command = Command.parse(args);
        if (command.mode() == Mode.USAGE) {
            System.err.println(USAGE);
            System.exit(2);
            return;
        }

        Map<String, String> env = ConfigLoader.loadEnvironment(Path.of(""), System.getenv(), LOGGER::info);
        Clock clock = Clock.systemUTC();
        TickRunner runner = createRunner(env, clock, LOGGER::warning);

        switch (command.mode()) {
            case ONCE -> runner.tick();
            case RUN_GROUP -> {
                if (!runner.schedule().hasGroup(command.group())) {
                    System.err.println("Unknown job group: " + command.group()
                            + " (known: " + String.join(", ", runner.schedule().groups().keySet()) + ")");
                    System.exit(2);
                    return;
                }
                TickReport report = runner.runGroups(List.of(command.group()));
                if (report.failedCount() > 0) {
                    System.exit(1);
                }
            }
            default -> runDaemon(runner, clock);
        }
    }

    static TickRunner createRunner(Map<String, String> env, Clock clock, Consumer<String> warn) {
        DispatcherSettings settings = ConfigLoader.loadSettings(env);
        Schedule schedule = ConfigLoader.loadSchedule(ConfigLoader.configDir(env));
        warnOnCollisions(schedule, warn);

        HttpClient httpClient = HttpClientFactory.create(ConfigLoader.connectTimeout(env), env);
        EventBus eventBus = new EventBus();
        new TickLogger(eventBus);

        DispatchContext context = new DispatchContext(
                new HttpJobTrigger(httpClient, settings.requestTimeout(), clock),
                eventBus,
                clock,
                settings
        );
        LOGGER.info("Dispatching to " + settings + " with " + schedule.rules().size() + " window rules");
        for (WindowRule rule : schedule.rules()) {
            LOGGER.config("Rule " + rule.describe());
        }
        return new TickRunner(schedule, context);
    }

    static void warnOnCollisions(Schedule schedule, Consumer<String> warn) {
        for (WindowMatcher.Collision collision : schedule.matcher().collisions()) {
            warn.accept("Rules " + collision.ruleNames() + " all fire at " + collision.sample());
        }
    }

    private static void runDaemon(TickRunner runner, Clock clock) throws InterruptedException {
        SchedulerService scheduler = new SchedulerService(runner, clock);
        scheduler.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not read bundled logging.properties; using JDK defaults", e);
        }
    }

    enum Mode {
        DAEMON,
        ONCE,
        RUN_GROUP,
        USAGE
    }

    record Command(Mode mode, String group) {
        static Command parse(String[] args) {
            if (args.length == 0) {
                return new Command(Mode.DAEMON, null);
            }
            if (args.length == 1 && "once".equals(args[0])) {
                return new Command(Mode.ONCE, null);
            }
            if (args.length == 2 && "run".equals(args[0]) && !args[1].isBlank()) {
                return new Command(Mode.RUN_GROUP, args[1]);
            }
            return new Command(Mode.USAGE, null);
        }
    }
}
