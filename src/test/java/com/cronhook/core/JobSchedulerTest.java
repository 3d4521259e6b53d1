package com.cronhook.core;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class JobSchedulerTest {

    private static JobScheduler scheduler(JobStore store, JobDispatcher dispatcher) {
        return new JobScheduler(store, dispatcher, ZoneOffset.UTC, Clock.systemUTC(), 2);
    }

    @Test
    public void testRestartRestoresJobs() throws Exception {
        Path file = Files.createTempDirectory("cronhook").resolve("jobs.json");

        JobScheduler first = scheduler(new FileJobStore(file), new RecordingDispatcher());
        first.start();
        first.getRegistry().create("daily", "0 6 * * *", new JobPayload("http://localhost/daily", null));
        first.getRegistry().create("hourly", "0 * * * *", null);
        List<Job> before = first.getRegistry().list();
        first.shutdown();

        JobScheduler second = scheduler(new FileJobStore(file), new RecordingDispatcher());
        second.start();
        try {
            assertEquals(before, second.getRegistry().list());
            for (Job job : before) {
                assertTrue(second.getRegistry().nextFireTime(job.id()).isPresent());
            }
        } finally {
            second.shutdown();
        }
    }

    @Test
    public void testInvalidPersistedScheduleIsSkipped() throws Exception {
        Path file = Files.createTempDirectory("cronhook").resolve("jobs.json");
        Files.writeString(file, """
[
  {"id": "ok", "name": "fine", "schedule": "*/5 * * * *", "payload": null, "createdAt": "2024-01-01T00:00:00Z"},
  {"id": "bad", "name": "broken", "schedule": "99 * * * *", "payload": null, "createdAt": "2024-01-01T00:00:00Z"},
  {"id": "ok", "name": "duplicate", "schedule": "* * * * *", "payload": null, "createdAt": "2024-01-01T00:00:00Z"}
]
""");
        JobScheduler scheduler = scheduler(new FileJobStore(file), new RecordingDispatcher());
        scheduler.start();
        try {
            List<Job> jobs = scheduler.getRegistry().list();
            assertEquals(1, jobs.size());
            assertEquals("fine", jobs.get(0).name());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    public void testCorruptStoreStartsEmpty() throws Exception {
        Path file = Files.createTempDirectory("cronhook").resolve("jobs.json");
        Files.writeString(file, "this is not json");
        JobScheduler scheduler = scheduler(new FileJobStore(file), new RecordingDispatcher());
        scheduler.start();
        try {
            assertTrue(scheduler.isStarted());
            assertEquals(0, scheduler.getRegistry().size());
            scheduler.getRegistry().create("fresh", "* * * * *", null);
        } finally {
            scheduler.shutdown();
        }
        assertEquals(1, new FileJobStore(file).load().size());
    }

    @Test
    public void testShutdownStopsFiringAndFlushes() throws Exception {
        Path file = Files.createTempDirectory("cronhook").resolve("jobs.json");
        RecordingDispatcher dispatcher = new RecordingDispatcher();
        JobScheduler scheduler = scheduler(new FileJobStore(file), dispatcher);
        scheduler.start();
        Job job = scheduler.getRegistry().create("tick", "* * * * * *", null);
        Thread.sleep(1300);

        List<Job> atShutdown = scheduler.getRegistry().list();
        scheduler.shutdown();
        int fired = dispatcher.count(job.id());
        Thread.sleep(1500);

        assertTrue(fired >= 1);
        assertEquals(fired, dispatcher.count(job.id()));
        assertTrue(dispatcher.isShutdown());
        assertFalse(scheduler.isStarted());
        assertEquals(atShutdown, new FileJobStore(file).load());
        assertThrows(IllegalStateException.class, () -> scheduler.getRegistry().create("late", "* * * * *", null));
        scheduler.shutdown();
    }

    @Test
    public void testShutdownWithoutStartKeepsStore() throws Exception {
        InMemoryJobStore store = new InMemoryJobStore();
        JobScheduler scheduler = scheduler(store, new RecordingDispatcher());
        scheduler.shutdown();
        assertEquals(0, store.getSaveCount());
    }

    @Test
    public void testStartTwiceFails() {
        JobScheduler scheduler = scheduler(new InMemoryJobStore(), new RecordingDispatcher());
        scheduler.start();
        try {
            assertThrows(IllegalStateException.class, scheduler::start);
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    public void testWebhookFiresUntilDeleted() throws Exception {
        AtomicInteger hits = new AtomicInteger();
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/y", ex -> {
            hits.incrementAndGet();
            ex.getRequestBody().readAllBytes();
            ex.sendResponseHeaders(200, -1);
            ex.close();
        });
        server.start();
        String url = "http://localhost:" + server.getAddress().getPort() + "/y";
        JobScheduler scheduler = scheduler(new InMemoryJobStore(), new WebhookDispatcher(Duration.ofSeconds(2), 4));
        scheduler.start();
        try {
            Job job = scheduler.getRegistry().create("x", "* * * * * *", new JobPayload(url, null));
            Thread.sleep(2600);
            assertTrue(hits.get() >= 2, "hits " + hits.get());

            scheduler.getRegistry().delete(job.id());
            Thread.sleep(300);
            int afterDelete = hits.get();
            Thread.sleep(1500);
            assertEquals(afterDelete, hits.get());
        } finally {
            scheduler.shutdown();
            server.stop(0);
        }
    }

    @Test
    public void testFailedDispatchDoesNotStopSchedule() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        WebhookDispatcher dispatcher = new WebhookDispatcher(Duration.ofMillis(500), 4);
        AtomicInteger failures = new AtomicInteger();
        dispatcher.addListener(o -> {
            if (!o.success()) failures.incrementAndGet();
        });
        JobScheduler scheduler = scheduler(new InMemoryJobStore(), dispatcher);
        scheduler.start();
        try {
            Job job = scheduler.getRegistry().create("refused", "* * * * * *",
                    new JobPayload("http://localhost:" + port + "/hook", null));
            Thread.sleep(2800);
            assertTrue(failures.get() >= 2, "failures " + failures.get());
            assertTrue(scheduler.getRegistry().get(job.id()).isPresent());
        } finally {
            scheduler.shutdown();
        }
    }
}
