package edu.purdue.dsnl.procsim;

import edu.purdue.dsnl.procsim.exception.ConfigurationException;

import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

public class PoissonRequestGenerator extends RequestGenerator {
    private final RandomGenerator random;

    private final double lambda;

    private final double mu;

    private final ServiceDistribution serviceDistribution;

    /** Probability of color 1; negative while requests are not colored. */
    private double colorRatio = -1;

    public PoissonRequestGenerator(Simulator sim, RequestsAcceptable acceptor, double lambda, double mu,
            double duration, ServiceDistribution serviceDistribution, long seed) {
        super(sim, acceptor, duration);
        if (!(lambda > 0) || !(mu > 0)) {
            throw new ConfigurationException(
                    String.format("arrival and service rates must be positive, got lambda=%f mu=%f", lambda, mu));
        }
        this.lambda = lambda;
        this.mu = mu;
        this.serviceDistribution = serviceDistribution;
        this.random = new SplittableRandom(seed);
    }

    /** Tags every request as colored: color 1 with probability {@code ratio}, else color 0. */
    public void setColorRatio(double ratio) {
        if (!(ratio >= 0 && ratio <= 1)) {
            throw new ConfigurationException("color ratio must be within [0, 1], got " + ratio);
        }
        colorRatio = ratio;
    }

    @Override
    protected Request nextRequest() {
        double service = serviceDistribution.sample(random, mu);
        if (colorRatio < 0) {
            return Request.plain(time, service);
        }
        return Request.colored(time, service, random.nextDouble() < colorRatio ? 1 : 0);
    }

    @Override
    protected double getNextInterarrival() {
        return random.nextExponential() / lambda;
    }
}
