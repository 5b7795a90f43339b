package edu.purdue.dsnl.procsim.processor;

import edu.purdue.dsnl.procsim.Request;
import edu.purdue.dsnl.procsim.Simulator;

/** Leaves {@code remainingService} untouched, so the next processor serves it in full. */
public abstract class ClassWeightedProcessor extends QueueingProcessor {
    static final double HEAVY_MULTIPLIER = 2;

    private final int heavyColor;

    protected ClassWeightedProcessor(Simulator sim, int heavyColor) {
        super(sim);
        this.heavyColor = heavyColor;
    }

    double costMultiplier(Request r) {
        switch (r.getKind()) {
            case COLORED:
                return r.getColor() == heavyColor ? HEAVY_MULTIPLIER : 1;
            default:
                return 1;
        }
    }

    @Override
    protected double serviceDelay(Request r) {
        return costMultiplier(r) * r.getRemainingService();
    }
}
