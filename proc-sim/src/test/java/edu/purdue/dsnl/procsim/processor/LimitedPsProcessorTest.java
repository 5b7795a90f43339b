package edu.purdue.dsnl.procsim.processor;

import edu.purdue.dsnl.procsim.Arrivals;
import edu.purdue.dsnl.procsim.RecordingDrain;
import edu.purdue.dsnl.procsim.Request;
import edu.purdue.dsnl.procsim.Simulator;
import edu.purdue.dsnl.procsim.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LimitedPsProcessorTest {

    private static final double EPS = 1e-9;

    private Simulator sim;
    private RecordingDrain drain;

    @BeforeEach
    void setUp() {
        sim = new Simulator();
        drain = new RecordingDrain();
    }

    private LimitedPsProcessor processor(int limit, OverflowDecay decay) {
        var p = new LimitedPsProcessor(sim, limit, decay);
        p.setRequestDrain(drain);
        return p;
    }

    @Test
    @DisplayName("Should hold the second arrival in overflow until the first departs")
    void shouldOverflowBeyondLimit() {
        var p = processor(1, OverflowDecay.NONE);
        var a = Request.plain(0, 5);
        var b = Request.plain(0, 7);
        Arrivals.at(sim, 0, p, a, b);

        sim.runUntil(0);
        assertEquals(List.of(a), p.getActiveRequests());
        assertEquals(List.of(b), p.getOverflowRequests());
        assertEquals(1, p.queueLength());
        assertEquals(1, p.getCount());

        sim.runUntil(5);
        assertEquals(5, a.getTimeComplete(), EPS);
        assertEquals(List.of(b), p.getActiveRequests());
        assertTrue(p.getOverflowRequests().isEmpty());
        assertEquals(7, b.getRemainingService(), EPS);

        sim.doAllEvents();
        assertEquals(12, b.getTimeComplete(), EPS);
    }

    @Test
    @DisplayName("Should age overflowed requests by the active share by default")
    void shouldDecayOverflowWithActiveShare() {
        var p = new LimitedPsProcessor(sim, 1);
        p.setRequestDrain(drain);
        var a = Request.plain(0, 5);
        var b = Request.plain(0, 7);
        Arrivals.at(sim, 0, p, a, b);

        sim.runUntil(5);
        assertEquals(OverflowDecay.ACTIVE_SHARE, p.getOverflowDecay());
        assertEquals(5, a.getTimeComplete(), EPS);
        assertEquals(List.of(b), p.getActiveRequests());
        assertEquals(2, b.getRemainingService(), EPS);

        sim.doAllEvents();
        assertEquals(7, b.getTimeComplete(), EPS);
    }

    @Test
    @DisplayName("Should share among admitted requests only")
    void shouldShareAmongActiveOnly() {
        var p = processor(2, OverflowDecay.NONE);
        var a = Request.plain(0, 4);
        var b = Request.plain(0, 4);
        var c = Request.plain(0, 2);
        Arrivals.at(sim, 0, p, a, b, c);

        sim.doAllEvents();

        assertEquals(List.of(a, b, c), drain.terminated);
        assertEquals(8, a.getTimeComplete(), EPS);
        assertEquals(8, b.getTimeComplete(), EPS);
        assertEquals(10, c.getTimeComplete(), EPS);
    }

    @Test
    @DisplayName("Should clamp an overflowed request decayed past zero")
    void shouldClampOverflowDecay() {
        var p = processor(2, OverflowDecay.ACTIVE_SHARE);
        var a = Request.plain(0, 4);
        var b = Request.plain(0, 4);
        var c = Request.plain(0, 2);
        Arrivals.at(sim, 0, p, a, b, c);

        sim.runUntil(8);

        assertEquals(List.of(a, b, c), drain.terminated);
        assertEquals(8, c.getTimeComplete(), EPS);
        assertEquals(0, c.getRemainingService());
    }

    @Test
    @DisplayName("Should admit overflowed requests in arrival order")
    void shouldAdmitFifo() {
        var p = processor(1, OverflowDecay.NONE);
        var a = Request.plain(0, 1);
        var b = Request.plain(0, 5);
        var c = Request.plain(0, 1);
        Arrivals.at(sim, 0, p, a, b, c);

        sim.runUntil(0);
        assertEquals(2, p.queueLength());

        sim.doAllEvents();
        assertEquals(List.of(a, b, c), drain.terminated);
        assertEquals(1, a.getTimeComplete(), EPS);
        assertEquals(6, b.getTimeComplete(), EPS);
        assertEquals(7, c.getTimeComplete(), EPS);
    }

    @Test
    @DisplayName("Should behave like plain processor sharing below the limit")
    void shouldMatchPsBelowLimit() {
        var p = processor(5, OverflowDecay.NONE);
        var a = Request.plain(0, 10);
        var b = Request.plain(0, 20);
        Arrivals.at(sim, 0, p, a, b);

        sim.doAllEvents();

        assertEquals(20, a.getTimeComplete(), EPS);
        assertEquals(30, b.getTimeComplete(), EPS);
        assertEquals(0, p.queueLength());
    }

    @Test
    @DisplayName("Should terminate every request exactly once, never straight from overflow")
    void shouldTerminateOnlyFromActiveSet() {
        var p = processor(2, OverflowDecay.ACTIVE_SHARE);
        p.setWorkerCount(2);
        for (int i = 0; i < 20; i++) {
            double t = i * 0.5;
            Arrivals.at(sim, t, p, Request.plain(t, 1 + i % 3));
        }
        Arrivals.run(sim, 0.25, () -> assertTrue(p.getCount() <= p.getLimit()));

        sim.doAllEvents();

        assertEquals(20, drain.terminated.size());
        assertEquals(20, drain.terminated.stream().distinct().count());
        assertEquals(0, p.getCount());
        assertEquals(0, p.queueLength());
    }

    @Test
    @DisplayName("Should reject a limit below one")
    void shouldRejectBadLimit() {
        assertThrows(ConfigurationException.class, () -> new LimitedPsProcessor(sim, 0));
    }
}
