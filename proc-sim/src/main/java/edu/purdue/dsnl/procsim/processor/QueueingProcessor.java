package edu.purdue.dsnl.procsim.processor;

import edu.purdue.dsnl.procsim.Request;
import edu.purdue.dsnl.procsim.Simulator;

import java.util.ArrayDeque;
import java.util.Deque;

public abstract class QueueingProcessor extends Processor {

    protected final Deque<Request> inQueue = new ArrayDeque<>();

    private Request inService;

    protected QueueingProcessor(Simulator sim) {
        super(sim);
    }

    @Override
    public void acceptRequest(Request request) {
        inQueue.add(request);
        if (inService == null) {
            receiveNext();
        }
    }

    @Override
    public int queueLength() {
        return getInQueueLen();
    }

    public int getInQueueLen() {
        return inQueue.size();
    }

    @Override
    public void execute() {
        var r = inService;
        inService = null;
        complete(r);
        // complete() may have fed this processor again through a loop in the topology
        if (inService == null) {
            receiveNext();
        }
    }

    /** Puts a partially served request back at the tail of this processor's own queue. */
    protected void enqueueSelf(Request r) {
        inQueue.add(r);
    }

    protected abstract double serviceDelay(Request r);

    protected abstract void complete(Request r);

    private void receiveNext() {
        var r = inQueue.poll();
        if (r != null) {
            inService = r;
            suspendFor(serviceDelay(r));
        }
    }
}
