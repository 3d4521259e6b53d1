package com.cronhook.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Creates JobScheduler instances using configuration from environment
 * variables, system properties and an optional properties file. Entries of
 * the properties file become system properties, so they take precedence over
 * environment variables.
 */
public class JobSchedulerFactory {
    private static final Logger log = LoggerFactory.getLogger(JobSchedulerFactory.class);

    private final Path propsPath;

    public JobSchedulerFactory() {
        this(getDefaultPath());
    }

    public JobSchedulerFactory(String path) {
        this(Paths.get(path));
    }

    public JobSchedulerFactory(Path path) {
        this.propsPath = path;
        loadProps();
    }

    /** Returns a new, not yet started scheduler using the current configuration. */
    public JobScheduler getScheduler() {
        Path dataFile = Paths.get(Config.get("DATA_FILE", "jobs.json"));
        WebhookDispatcher dispatcher = new WebhookDispatcher();
        log.info("Using job file {}, time zone {}, webhook timeout {}",
                dataFile.toAbsolutePath(), Config.getZone(), dispatcher.getTimeout());
        return new JobScheduler(new FileJobStore(dataFile), dispatcher);
    }

    private static Path getDefaultPath() {
        String p = System.getProperty("cronhook.properties");
        if (p == null || p.isEmpty()) {
            p = System.getenv("CRONHOOK_PROPERTIES");
        }
        if (p == null || p.isEmpty()) {
            p = "cronhook.properties";
        }
        return Paths.get(p);
    }

    private synchronized void loadProps() {
        if (!Files.exists(propsPath)) {
            return;
        }
        Properties p = new Properties();
        try (var in = Files.newInputStream(propsPath)) {
            p.load(in);
            for (String name : p.stringPropertyNames()) {
                System.setProperty(name, p.getProperty(name));
            }
            log.info("Loaded {} settings from {}", p.size(), propsPath);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", propsPath, e.getMessage());
        }
    }
}
