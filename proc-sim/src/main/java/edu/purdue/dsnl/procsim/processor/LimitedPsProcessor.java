package edu.purdue.dsnl.procsim.processor;

import edu.purdue.dsnl.procsim.Request;
import edu.purdue.dsnl.procsim.Simulator;
import edu.purdue.dsnl.procsim.exception.ConfigurationException;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Processor sharing with at most {@code limit} requests in service. A request arriving while
 * {@code limit} are running waits in a FIFO overflow queue until one of them finishes.
 */
public class LimitedPsProcessor extends PsProcessor {

    private static final Logger log = LoggerFactory.getLogger(LimitedPsProcessor.class);

    @Getter private final int limit;

    @Getter private final OverflowDecay overflowDecay;

    private final Deque<Request> overflow = new ArrayDeque<>();

    public LimitedPsProcessor(Simulator sim, int limit) {
        this(sim, limit, OverflowDecay.ACTIVE_SHARE);
    }

    public LimitedPsProcessor(Simulator sim, int limit, OverflowDecay overflowDecay) {
        super(sim);
        if (limit < 1) {
            throw new ConfigurationException("limit must be at least 1, got " + limit);
        }
        this.limit = limit;
        this.overflowDecay = overflowDecay;
    }

    public List<Request> getOverflowRequests() {
        return List.copyOf(overflow);
    }

    @Override
    public int queueLength() {
        return overflow.size();
    }

    @Override
    protected void updateServiceTimes() {
        // captured before super advances prevTime
        double diff = (sim.now() - prevTime) * getFactor();
        super.updateServiceTimes();
        if (overflowDecay == OverflowDecay.ACTIVE_SHARE && diff > 0) {
            for (Request r : overflow) {
                r.subServiceTime(diff);
            }
        }
    }

    @Override
    protected void admit(Request r) {
        if (count == limit) {
            log.debug("Processor {} full ({} running), request {} overflows", getProcessorId(), count,
                    r.getRequestId());
            overflow.addLast(r);
        } else {
            super.admit(r);
        }
    }

    @Override
    protected void completeCurrent() {
        super.completeCurrent();
        var next = overflow.pollFirst();
        if (next != null) {
            log.debug("Processor {} admits request {} from overflow, {} still waiting", getProcessorId(),
                    next.getRequestId(), overflow.size());
            super.admit(next);
        }
    }
}
