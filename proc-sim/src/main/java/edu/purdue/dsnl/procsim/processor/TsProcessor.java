package edu.purdue.dsnl.procsim.processor;

import edu.purdue.dsnl.procsim.Request;
import edu.purdue.dsnl.procsim.Simulator;
import edu.purdue.dsnl.procsim.exception.ConfigurationException;

import lombok.Getter;

/** A preempted request goes behind anything that arrived during its quantum. */
public class TsProcessor extends QueueingProcessor {

    @Getter private final double quantum;

    public TsProcessor(Simulator sim, double quantum) {
        super(sim);
        if (!(quantum > 0) || Double.isInfinite(quantum)) {
            throw new ConfigurationException("quantum must be positive and finite, got " + quantum);
        }
        this.quantum = quantum;
    }

    private boolean finishesThisTurn(Request r) {
        return r.getRemainingService() <= quantum;
    }

    @Override
    protected double serviceDelay(Request r) {
        if (finishesThisTurn(r)) {
            return r.getRemainingService() + ctxCost;
        }
        return quantum + ctxCost;
    }

    @Override
    protected void complete(Request r) {
        if (finishesThisTurn(r)) {
            r.subServiceTime(r.getRemainingService());
            terminate(r);
        } else {
            r.subServiceTime(quantum);
            enqueueSelf(r);
        }
    }
}
