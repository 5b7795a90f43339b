package edu.purdue.dsnl.procsim;

import edu.purdue.dsnl.procsim.exception.ConfigurationException;

/** First request goes out one interval in. */
public class MonitorRequestGenerator extends RequestGenerator {
    private final double interval;

    private final double monitorService;

    public MonitorRequestGenerator(Simulator sim, RequestsAcceptable acceptor, double interval,
            double monitorService, double duration) {
        super(sim, acceptor, duration);
        if (!(interval > 0)) {
            throw new ConfigurationException("monitor interval must be positive, got " + interval);
        }
        this.interval = interval;
        this.monitorService = monitorService;
    }

    @Override
    protected double getFirstArrival() {
        return interval;
    }

    @Override
    protected Request nextRequest() {
        return Request.monitor(time, monitorService);
    }

    @Override
    protected double getNextInterarrival() {
        return interval;
    }
}
