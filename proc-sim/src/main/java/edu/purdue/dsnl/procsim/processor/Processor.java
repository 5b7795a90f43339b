package edu.purdue.dsnl.procsim.processor;

import edu.purdue.dsnl.procsim.Event;
import edu.purdue.dsnl.procsim.Request;
import edu.purdue.dsnl.procsim.RequestDrain;
import edu.purdue.dsnl.procsim.RequestsAcceptable;
import edu.purdue.dsnl.procsim.Simulator;
import edu.purdue.dsnl.procsim.exception.ConfigurationException;
import edu.purdue.dsnl.procsim.exception.InvariantViolationException;

import lombok.Getter;
import lombok.Setter;

/**
 * A processor is itself the event that wakes it up. Waiting for {@code d} time units means
 * scheduling this event {@code d} ahead; {@link #execute()} runs when the wait is over.
 */
public abstract class Processor extends Event implements RequestsAcceptable {
    private static int idCounter = 0;

    @Getter private final int processorId = idCounter++;

    protected final Simulator sim;

    @Setter protected RequestDrain requestDrain;

    @Getter protected double ctxCost;

    /** An optional acceptor (another processor) following this one. */
    @Setter protected RequestsAcceptable nextRequestsAcceptor;

    protected Processor(Simulator sim) {
        this.sim = sim;
    }

    public void setCtxCost(double cost) {
        if (Double.isNaN(cost) || cost < 0) {
            throw new ConfigurationException("context switch cost must be non-negative, got " + cost);
        }
        ctxCost = cost;
    }

    protected void suspendFor(double d) {
        if (Double.isNaN(d) || d < 0) {
            throw new InvariantViolationException("negative suspension " + d + " on processor " + processorId);
        }
        time = sim.now() + d;
        sim.addEvent(this);
    }

    protected void terminate(Request r) {
        if (requestDrain == null) {
            throw new InvariantViolationException("processor " + processorId + " has no drain");
        }
        r.markTerminated(sim.now());
        requestDrain.terminateRequest(r);
    }

    protected void sendDownstream(Request r) {
        downstream().acceptRequest(r);
    }

    protected int getOutQueueLen() {
        return downstream().queueLength();
    }

    private RequestsAcceptable downstream() {
        if (nextRequestsAcceptor == null) {
            throw new InvariantViolationException("processor " + processorId + " has no downstream");
        }
        return nextRequestsAcceptor;
    }
}
