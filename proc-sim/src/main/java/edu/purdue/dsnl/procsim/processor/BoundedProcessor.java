package edu.purdue.dsnl.procsim.processor;

import edu.purdue.dsnl.procsim.Request;
import edu.purdue.dsnl.procsim.Simulator;
import edu.purdue.dsnl.procsim.exception.ConfigurationException;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Color 1 costs double. After service a request is forwarded only if the downstream queue holds
 * fewer than {@code bufSize} requests; otherwise it is dropped here (tail drop).
 */
public class BoundedProcessor extends ClassWeightedProcessor {

    private static final Logger log = LoggerFactory.getLogger(BoundedProcessor.class);

    @Getter private final int bufSize;

    public BoundedProcessor(Simulator sim, int bufSize) {
        super(sim, 1);
        if (bufSize < 0) {
            throw new ConfigurationException("buffer size must be non-negative, got " + bufSize);
        }
        this.bufSize = bufSize;
    }

    @Override
    protected void complete(Request r) {
        if (bufSize > 0 && getOutQueueLen() < bufSize) {
            sendDownstream(r);
        } else {
            log.trace("Dropping request {} at t={}", r.getRequestId(), sim.now());
            r.setDropped(true);
            terminate(r);
        }
    }
}
