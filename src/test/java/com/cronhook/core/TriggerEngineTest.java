package com.cronhook.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledThreadPoolExecutor;

import static org.junit.jupiter.api.Assertions.*;

public class TriggerEngineTest {
    private final ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(2);
    private final RecordingDispatcher dispatcher = new RecordingDispatcher();

    @AfterEach
    public void tearDown() {
        timer.shutdownNow();
    }

    private TriggerEngine engine(String id, String schedule) {
        Job job = new Job(id, "test", schedule, null, Instant.now());
        return new TriggerEngine(job, CronSchedule.parse(schedule, ZoneOffset.UTC), timer, dispatcher, Clock.systemUTC());
    }

    @Test
    public void testFiresOnEveryOccurrence() throws Exception {
        TriggerEngine engine = engine("tick", "* * * * * *");
        engine.arm();
        Thread.sleep(2600);
        engine.stop();
        int fired = dispatcher.count("tick");
        assertTrue(fired >= 2 && fired <= 4, "fired " + fired);
    }

    @Test
    public void testArmComputesFutureInstant() {
        TriggerEngine engine = engine("future", "0 0 1 1 *");
        Instant before = Instant.now();
        engine.arm();
        assertEquals(TriggerEngine.State.ARMED, engine.getState());
        assertTrue(engine.getNextFireTime().isAfter(before));
        engine.stop();
    }

    @Test
    public void testStopPreventsFurtherFirings() throws Exception {
        TriggerEngine engine = engine("stop", "* * * * * *");
        engine.arm();
        Thread.sleep(1300);
        engine.stop();
        int afterStop = dispatcher.count("stop");
        Thread.sleep(1500);
        assertEquals(afterStop, dispatcher.count("stop"));
        assertEquals(TriggerEngine.State.STOPPED, engine.getState());
        assertNull(engine.getNextFireTime());
        engine.stop();
        assertEquals(TriggerEngine.State.STOPPED, engine.getState());
    }

    @Test
    public void testStopBeforeFirstFiring() throws Exception {
        TriggerEngine engine = engine("early", "* * * * * *");
        engine.arm();
        engine.stop();
        Thread.sleep(1500);
        assertEquals(0, dispatcher.count("early"));
    }

    @Test
    public void testDispatcherFailureDoesNotStopTrigger() throws Exception {
        dispatcher.setFailing(true);
        TriggerEngine engine = engine("failing", "* * * * * *");
        engine.arm();
        Thread.sleep(2600);
        assertEquals(TriggerEngine.State.ARMED, engine.getState());
        engine.stop();
        assertTrue(dispatcher.count("failing") >= 2);
    }

    @Test
    public void testScheduleWithoutOccurrence() {
        TriggerEngine engine = engine("never", "0 0 30 2 *");
        engine.arm();
        assertNull(engine.getNextFireTime());
        assertEquals(TriggerEngine.State.ARMED, engine.getState());
        engine.stop();
    }

    @Test
    public void testArmTwiceFails() {
        TriggerEngine engine = engine("twice", "* * * * *");
        engine.arm();
        assertThrows(IllegalStateException.class, engine::arm);
        engine.stop();
    }

    @Test
    public void testStoppedWhenTimerIsShutDown() {
        timer.shutdownNow();
        TriggerEngine engine = engine("late", "* * * * *");
        engine.arm();
        assertEquals(TriggerEngine.State.STOPPED, engine.getState());
    }
}
