package edu.purdue.dsnl.procsim;

import edu.purdue.dsnl.procsim.exception.InvariantViolationException;

import java.util.TreeSet;

/**
 * Single-threaded event loop owning the virtual clock. Events are ordered by time, then by
 * creation order, so two runs with the same inputs produce the same trace.
 *
 * <p>Instances are passed to whatever needs the clock; there is no global simulator.
 *
 * <p>An event's {@code time} must not change while it is queued: remove it first, update the
 * time, then add it again.
 */
public class Simulator {
    private final TreeSet<Event> events = new TreeSet<>();

    private double time;

    public double now() {
        return time;
    }

    public boolean containsEvent(Event e) {
        return events.contains(e);
    }

    public void addEvent(Event e) {
        if (e.time < time) {
            throw new InvariantViolationException(
                    String.format("event scheduled at %f, clock already at %f", e.time, time));
        }
        events.add(e);
    }

    public void removeEvent(Event e) {
        events.remove(e);
    }

    public int pendingEvents() {
        return events.size();
    }

    public void doAllEvents() {
        runUntil(Double.POSITIVE_INFINITY);
    }

    /** Executes events with {@code time <= horizon}; later events stay queued. */
    public void runUntil(double horizon) {
        while (!events.isEmpty() && events.first().time <= horizon) {
            var e = events.pollFirst();
            time = e.time;
            e.execute();
        }
    }
}
