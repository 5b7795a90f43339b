package edu.purdue.dsnl.procsim.processor;

import edu.purdue.dsnl.procsim.Request;
import edu.purdue.dsnl.procsim.Simulator;

public class BoundedProcessor2 extends ClassWeightedProcessor {

    public BoundedProcessor2(Simulator sim) {
        super(sim, 0);
    }

    @Override
    protected void complete(Request r) {
        terminate(r);
    }
}
