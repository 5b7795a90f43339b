package edu.purdue.dsnl.procsim.processor;

import edu.purdue.dsnl.procsim.Request;
import edu.purdue.dsnl.procsim.Simulator;

public class RtcProcessor extends QueueingProcessor {

    public RtcProcessor(Simulator sim) {
        super(sim);
    }

    @Override
    protected double serviceDelay(Request r) {
        return r.getRemainingService() + ctxCost;
    }

    @Override
    protected void complete(Request r) {
        r.subServiceTime(r.getRemainingService());
        if (r.getKind() == Request.Kind.MONITOR) {
            r.recordQueueDepth(getInQueueLen());
        }
        terminate(r);
    }
}
