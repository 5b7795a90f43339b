package edu.purdue.dsnl.procsim;

import java.util.random.RandomGenerator;

/** Service time distributions, all with mean {@code 1 / mu}. */
public enum ServiceDistribution {
    DETERMINISTIC {
        @Override
        public double sample(RandomGenerator random, double mu) {
            return 1 / mu;
        }
    },
    EXPONENTIAL {
        @Override
        public double sample(RandomGenerator random, double mu) {
            return random.nextExponential() / mu;
        }
    },
    /** 90% short requests at half the mean, 10% long ones at 5.5x the mean. */
    BIMODAL {
        @Override
        public double sample(RandomGenerator random, double mu) {
            return random.nextDouble() < 0.9 ? 0.5 / mu : 5.5 / mu;
        }
    };

    public abstract double sample(RandomGenerator random, double mu);
}
