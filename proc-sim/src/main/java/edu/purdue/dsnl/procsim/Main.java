package edu.purdue.dsnl.procsim;

import picocli.CommandLine;

import java.io.File;
import java.util.Optional;

@CommandLine.Command(name = "proc-sim", mixinStandardHelpOptions = true, subcommands = {
        SingleSetup.class,
        BoundedSetup.class,
})
public class Main {
    public static class ParentOptions {
        @CommandLine.Option(names = { "--lambda" }, description = "Request arrival rate")
        public double lambda = 0.005;

        @CommandLine.Option(names = { "--mu" }, description = "Service rate, the inverse of the mean service time")
        public double mu = 0.1;

        @CommandLine.Option(names = { "-d", "--duration" })
        public double duration = 1000000;

        @CommandLine.Option(names = { "--seed" })
        public long seed = 42;

        @CommandLine.Option(names = { "--gen-type" })
        public ServiceDistribution genType = ServiceDistribution.EXPONENTIAL;

        @CommandLine.Option(names = {
                "--trace-path" }, description = "CSV trace with arrival_time and service_time columns. If specified,"
                        + " requests are replayed from the trace instead of a Poisson source")
        public Optional<String> tracePath = Optional.empty();

        @CommandLine.Option(names = { "--monitor-interval" }, description = "Send a monitor request this often")
        public Optional<Double> monitorInterval = Optional.empty();

        @CommandLine.Option(names = { "-l", "--log" })
        public File logFile;

        protected RequestGenerator createGenerator(Simulator sim, RequestsAcceptable acceptor) {
            if (tracePath.isPresent()) {
                return new TraceRequestGenerator(sim, acceptor, tracePath.get());
            }
            return new PoissonRequestGenerator(sim, acceptor, lambda, mu, duration, genType, seed);
        }

        protected void startMonitor(Simulator sim, RequestsAcceptable acceptor) {
            if (monitorInterval.isPresent()) {
                new MonitorRequestGenerator(sim, acceptor, monitorInterval.get(), 1 / mu, duration).start();
            }
        }
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }
}
