package edu.purdue.dsnl.procsim;

public abstract class RequestGenerator extends Event {
    protected final Simulator sim;

    private final RequestsAcceptable acceptor;

    private final double duration;

    protected int count = 0;

    @Override
    public void execute() {
        acceptor.acceptRequest(nextRequest());
        count++;
        time += getNextInterarrival();
        if (time < duration) {
            sim.addEvent(this);
        }
    }

    protected RequestGenerator(Simulator sim, RequestsAcceptable acceptor, double duration) {
        this.sim = sim;
        this.acceptor = acceptor;
        this.duration = duration;
    }

    /** Schedules the first arrival. */
    public void start() {
        time = sim.now() + getFirstArrival();
        if (time < duration) {
            sim.addEvent(this);
        }
    }

    public int getGenerated() {
        return count;
    }

    protected double getFirstArrival() {
        return 0;
    }

    /** Request arriving now; {@link #time} holds the arrival instant. */
    protected abstract Request nextRequest();

    /** Gap to the next arrival; {@code +Infinity} stops the generator. */
    protected abstract double getNextInterarrival();
}
