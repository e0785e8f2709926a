package com.uptimesentinel.service;

import com.uptimesentinel.core.bus.EventBus;
import com.uptimesentinel.core.model.ChannelBinding;
import com.uptimesentinel.core.model.Monitor;
import com.uptimesentinel.core.model.NotificationChannel;
import com.uptimesentinel.probes.api.ProbeRegistry;
import com.uptimesentinel.service.api.ApiServer;
import com.uptimesentinel.service.api.SseBroadcaster;
import com.uptimesentinel.service.config.ConfigLoader;
import com.uptimesentinel.service.config.ServiceSettings;
import com.uptimesentinel.service.http.HttpClientFactory;
import com.uptimesentinel.service.notify.AlertMessageFormatter;
import com.uptimesentinel.service.notify.NotificationDispatcher;
import com.uptimesentinel.service.notify.destination.DestinationRegistry;
import com.uptimesentinel.service.notify.destination.InvalidDestinationException;
import com.uptimesentinel.service.runtime.MonitorChecker;
import com.uptimesentinel.service.runtime.MonitorScheduler;
import com.uptimesentinel.service.store.CatalogMonitorStore;
import com.uptimesentinel.service.store.JsonlCheckLog;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Map<String, String> env = System.getenv();
        Path configDir = Path.of(env.getOrDefault("CONFIG_DIR", "config"));

        ServiceSettings settings = ConfigLoader.applyEnvironment(
                ConfigLoader.loadSettings(configDir),
                env,
                LOGGER::warning
        );
        Clock clock = Clock.systemUTC();
        EventBus eventBus = new EventBus();
        HttpClient httpClient = HttpClientFactory.create(settings.httpConnectTimeout());
        DestinationRegistry destinations = DestinationRegistry.defaults(httpClient, settings.dispatch().sendTimeout());

        CatalogMonitorStore store = new CatalogMonitorStore(new JsonlCheckLog(settings.checkLog()));
        loadCatalog(configDir, settings, destinations, store);

        NotificationDispatcher dispatcher = new NotificationDispatcher(
                store,
                destinations,
                new AlertMessageFormatter(settings.zone()),
                eventBus,
                clock,
                settings.dispatch()
        );
        MonitorChecker checker = new MonitorChecker(
                ProbeRegistry.defaults(httpClient),
                store,
                dispatcher,
                eventBus,
                clock,
                settings.slowResponseThresholdMillis()
        );
        MonitorScheduler scheduler = new MonitorScheduler(store, checker, eventBus, clock);
        SseBroadcaster broadcaster = new SseBroadcaster(eventBus);
        ApiServer apiServer = new ApiServer(
                settings.host(),
                settings.port(),
                store,
                scheduler,
                destinations,
                broadcaster,
                clock
        );

        scheduler.start();
        apiServer.start();
        LOGGER.info("Uptime Sentinel running with " + store.monitors().size() + " monitors and "
                + store.channels().size() + " notification channels");

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.stop();
            dispatcher.close();
            broadcaster.close();
            apiServer.stop();
            shutdownLatch.countDown();
        }));
        shutdownLatch.await();
    }

    static void loadCatalog(
            Path configDir,
            ServiceSettings settings,
            DestinationRegistry destinations,
            CatalogMonitorStore store
    ) {
        for (Monitor monitor : ConfigLoader.loadMonitors(configDir, settings.monitorDefaults())) {
            store.putMonitor(monitor);
        }
        for (NotificationChannel channel : ConfigLoader.loadChannels(configDir)) {
            try {
                destinations.validate(channel.url());
            } catch (InvalidDestinationException e) {
                throw new IllegalStateException("Invalid destination for channel '" + channel.name() + "': "
                        + e.getMessage(), e);
            }
            store.putChannel(channel);
        }
        List<ChannelBinding> bindings = ConfigLoader.loadBindings(configDir);
        for (ChannelBinding binding : bindings) {
            try {
                store.bind(binding);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid binding in " + configDir.resolve("bindings.json") + ": "
                        + e.getMessage(), e);
            }
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Failed to apply logging.properties: " + e.getMessage());
        }
    }
}
