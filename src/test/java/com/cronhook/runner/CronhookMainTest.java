package com.cronhook.runner;

import com.cronhook.core.FileJobStore;
import com.cronhook.core.JobScheduler;
import com.cronhook.core.RecordingDispatcher;
import com.cronhook.server.JobApiServer;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class CronhookMainTest {

    @Test
    public void testStopClosesApiAndSavesJobs() throws Exception {
        Path file = Files.createTempDirectory("cronhook").resolve("jobs.json");
        JobScheduler scheduler = new JobScheduler(new FileJobStore(file), new RecordingDispatcher(),
                ZoneOffset.UTC, Clock.systemUTC(), 1);
        scheduler.start();
        JobApiServer api = new JobApiServer(scheduler.getRegistry());
        api.start(0);
        scheduler.getRegistry().create("kept", "*/5 * * * *", null);

        CronhookMain.stop(api, scheduler);

        assertEquals(-1, api.getPort());
        assertFalse(scheduler.isStarted());
        assertEquals("kept", new FileJobStore(file).load().get(0).name());
    }
}
