package com.cronhook.runner;

import com.cronhook.core.Config;
import com.cronhook.core.JobScheduler;
import com.cronhook.core.JobSchedulerFactory;
import com.cronhook.server.JobApiServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point: restores the persisted jobs, serves the HTTP API and
 * saves the jobs again when the JVM is asked to terminate.
 */
public class CronhookMain {
    private static final Logger log = LoggerFactory.getLogger(CronhookMain.class);

    public static void main(String[] args) throws Exception {
        int port = args.length > 0 ? Integer.parseInt(args[0]) : Config.getInt("PORT", 3000);

        JobScheduler scheduler = new JobSchedulerFactory().getScheduler();
        scheduler.start();
        JobApiServer api = new JobApiServer(scheduler.getRegistry());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> stop(api, scheduler), "cronhook-shutdown"));
        try {
            api.start(port);
        } catch (Exception e) {
            log.error("Could not start HTTP API on port {}", port, e);
            System.exit(1);
        }
    }

    static void stop(JobApiServer api, JobScheduler scheduler) {
        log.info("Shutting down...");
        api.stop();
        scheduler.shutdown();
    }
}
