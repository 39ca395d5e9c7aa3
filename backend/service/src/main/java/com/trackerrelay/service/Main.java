package com.trackerrelay.service;

import com.trackerrelay.collectors.api.PipelineContext;
import com.trackerrelay.collectors.runtime.WorkerPool;
import com.trackerrelay.core.bus.EventBus;
import com.trackerrelay.core.util.Sleeper;
import com.trackerrelay.service.config.ConfigLoader;
import com.trackerrelay.service.config.RelayConfig;
import com.trackerrelay.service.http.HttpClientFactory;
import com.trackerrelay.service.runtime.RelayPipeline;
import com.trackerrelay.service.runtime.RunReport;
import com.trackerrelay.service.store.EventCodec;
import com.trackerrelay.service.store.JsonlEventStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final Path DEFAULT_CONFIG = Path.of("config/relay.json");
    private static final Path EVENT_LOG = Path.of("logs/events.jsonl");

    private Main() {
    }

    public static void main(String[] args) {
        installLogging();
        RelayConfig config = resolveConfig(args, System.getenv());
        if (!config.publish().hasToken()) {
            throw new IllegalStateException(ConfigLoader.TOKEN_ENV + " must be set to publish tracker lists");
        }
        LOGGER.info("Publishing to " + config.publish().owner() + "/" + config.publish().repo()
                + " from " + config.sources().urls().size() + " sources");

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(EVENT_LOG);
        EventCodec.subscribeAll(eventBus, eventStore::append);

        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(5));
        PipelineContext ctx = new PipelineContext(httpClient, eventBus, Clock.systemDefaultZone(), Sleeper.system());

        RunReport report;
        try (WorkerPool pool = new WorkerPool(config.workers())) {
            report = RelayPipeline.create(config, ctx, pool).run();
        }
        LOGGER.info("Run finished with status " + report.status());
        System.exit(report.exitCode());
    }

    static RelayConfig resolveConfig(String[] args, Map<String, String> env) {
        Path configFile = args.length > 0 ? Path.of(args[0]) : DEFAULT_CONFIG;
        RelayConfig fromFile;
        if (args.length > 0 || Files.exists(configFile)) {
            fromFile = ConfigLoader.load(configFile);
        } else {
            LOGGER.info("No " + configFile + " found, using built-in defaults");
            fromFile = RelayConfig.defaults();
        }
        return ConfigLoader.applyEnvironment(fromFile, env);
    }

    private static void installLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not load logging.properties, keeping JVM defaults", e);
        }
    }
}
