package edu.purdue.dsnl.procsim.processor;

import edu.purdue.dsnl.procsim.Request;
import edu.purdue.dsnl.procsim.Simulator;
import edu.purdue.dsnl.procsim.exception.ConfigurationException;
import edu.purdue.dsnl.procsim.exception.InvariantViolationException;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ideal processor sharing. With {@code count} active requests and {@code workerCount} workers,
 * every active request is served at rate {@code min(1, workerCount / count)}.
 *
 * <p>Instead of ticking, the processor keeps one timer armed for the request that will finish
 * first at the current rate. Whenever it wakes up, by that timer or by an arrival, it first
 * charges the elapsed time to all active requests using the rate that was in effect, then
 * changes membership, then re-arms. The rate is constant between membership changes, so this
 * is exact.
 */
public class PsProcessor extends Processor {

    private static final Logger log = LoggerFactory.getLogger(PsProcessor.class);

    @Getter protected int workerCount = 1;

    /** Number of requests in service. */
    @Getter protected int count;

    protected final List<Request> reqList = new ArrayList<>();

    /** Request the armed timer is waiting on; {@code null} while idle. */
    protected Request curr;

    /** Instant up to which remaining service times are current. */
    protected double prevTime;

    public PsProcessor(Simulator sim) {
        super(sim);
        prevTime = sim.now();
    }

    public PsProcessor(Simulator sim, int workerCount) {
        this(sim);
        setWorkerCount(workerCount);
    }

    /**
     * Changes the worker count. Time elapsed so far is charged at the old rate and the timer is
     * re-armed at the new one.
     */
    public void setWorkerCount(int workerCount) {
        if (workerCount < 1) {
            throw new ConfigurationException("worker count must be at least 1, got " + workerCount);
        }
        if (count == 0) {
            this.workerCount = workerCount;
            return;
        }
        log.debug("Processor {} worker count {} -> {} at t={}", getProcessorId(), this.workerCount,
                workerCount, sim.now());
        interrupt();
        updateServiceTimes();
        this.workerCount = workerCount;
        rearm();
    }

    public List<Request> getActiveRequests() {
        return Collections.unmodifiableList(reqList);
    }

    @Override
    public int queueLength() {
        return 0;
    }

    @Override
    public void acceptRequest(Request request) {
        interrupt();
        resume(Wakeup.arrival(request));
    }

    @Override
    public void execute() {
        resume(Wakeup.timeout());
    }

    protected void resume(Wakeup wakeup) {
        updateServiceTimes();
        if (wakeup.isInterrupted()) {
            admit(wakeup.getRequest());
        } else {
            completeCurrent();
        }
        rearm();
    }

    double getFactor() {
        if (workerCount >= count) {
            return 1.0;
        }
        return (double) workerCount / count;
    }

    /** Must run before any membership change. */
    protected void updateServiceTimes() {
        double now = sim.now();
        double diff = (now - prevTime) * getFactor();
        prevTime = now;
        if (diff == 0) {
            return;
        }
        log.trace("Processor {} decays {} active requests by {}", getProcessorId(), count, diff);
        for (Request r : reqList) {
            r.subServiceTime(diff);
        }
    }

    Request getMinService() {
        Request min = reqList.get(0);
        for (Request r : reqList) {
            if (r.getRemainingService() < min.getRemainingService()) {
                min = r;
            }
        }
        return min;
    }

    protected void admit(Request r) {
        reqList.add(r);
        count++;
    }

    protected void completeCurrent() {
        if (curr == null) {
            throw new InvariantViolationException("processor " + getProcessorId() + " woke up with nothing in service");
        }
        var r = curr;
        curr = null;
        reqList.remove(r);
        count--;
        terminate(r);
    }

    private void rearm() {
        if (count > 0) {
            curr = getMinService();
            suspendInterruptible(curr.getRemainingService() / getFactor());
        } else {
            curr = null;
            suspendInterruptible(-1);
        }
    }

    /** Arms the wake-up timer; a negative duration waits for the next arrival only. */
    protected void suspendInterruptible(double d) {
        if (d < 0) {
            return;
        }
        suspendFor(d);
    }

    private void interrupt() {
        sim.removeEvent(this);
    }
}
