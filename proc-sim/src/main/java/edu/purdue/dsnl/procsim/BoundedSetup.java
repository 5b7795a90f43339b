package edu.purdue.dsnl.procsim;

import edu.purdue.dsnl.procsim.processor.BoundedProcessor;
import edu.purdue.dsnl.procsim.processor.RtcProcessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "bounded")
public class BoundedSetup extends Main.ParentOptions implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BoundedSetup.class);

    @CommandLine.Option(names = { "-b", "--buf-size" })
    public int bufSize = 10;

    @CommandLine.Option(names = { "--color-ratio" }, description = "Fraction of requests with color 1")
    public double colorRatio = 0.5;

    @CommandLine.Option(names = { "--ctx-cost" }, description = "Context switch cost of the back processor")
    public double ctxCost = 0;

    @Override
    public Integer call() throws Exception {
        var sim = new Simulator();
        var drain = new StatsDrain();

        var back = new RtcProcessor(sim);
        back.setCtxCost(ctxCost);
        back.setRequestDrain(drain);

        var front = new BoundedProcessor(sim, bufSize);
        front.setRequestDrain(drain);
        front.setNextRequestsAcceptor(back);

        var gen = createGenerator(sim, front);
        if (gen instanceof PoissonRequestGenerator) {
            ((PoissonRequestGenerator) gen).setColorRatio(colorRatio);
        }
        gen.start();
        startMonitor(sim, front);

        log.info("Running bounded pipeline, bufSize={} lambda={} mu={}", bufSize, lambda, mu);
        sim.doAllEvents();
        log.info("Simulation finished at t={}, {} requests generated, {} dropped", sim.now(),
                gen.getGenerated(), drain.getDropped());

        drain.printSummary(System.out);
        if (logFile != null) {
            drain.writeLog(logFile);
        }
        return 0;
    }
}
