package edu.purdue.dsnl.procsim;

import edu.purdue.dsnl.procsim.exception.ConfigurationException;
import edu.purdue.dsnl.procsim.processor.BoundedProcessor2;
import edu.purdue.dsnl.procsim.processor.LimitedPsProcessor;
import edu.purdue.dsnl.procsim.processor.OverflowDecay;
import edu.purdue.dsnl.procsim.processor.Processor;
import edu.purdue.dsnl.procsim.processor.PsProcessor;
import edu.purdue.dsnl.procsim.processor.RtcProcessor;
import edu.purdue.dsnl.procsim.processor.TsProcessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "single")
public class SingleSetup extends Main.ParentOptions implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SingleSetup.class);

    @CommandLine.Option(names = { "-p", "--proc-type" })
    public ProcessorType procType = ProcessorType.RTC;

    @CommandLine.Option(names = { "--ctx-cost" })
    public double ctxCost = 0;

    @CommandLine.Option(names = { "-q", "--quantum" })
    public double quantum = 1;

    @CommandLine.Option(names = { "-w", "--workers" })
    public int workerCount = 1;

    @CommandLine.Option(names = { "--limit" })
    public int limit = 1;

    @CommandLine.Option(names = { "--overflow-decay" })
    public OverflowDecay overflowDecay = OverflowDecay.ACTIVE_SHARE;

    @CommandLine.Option(names = { "--color-ratio" }, description = "Fraction of requests with color 1")
    public double colorRatio = -1;

    Processor createProcessor(Simulator sim) {
        switch (procType) {
            case RTC:
                return new RtcProcessor(sim);
            case TS:
                return new TsProcessor(sim, quantum);
            case PS:
                return new PsProcessor(sim, workerCount);
            case LIMITED_PS:
                var p = new LimitedPsProcessor(sim, limit, overflowDecay);
                p.setWorkerCount(workerCount);
                return p;
            case BOUNDED2:
                return new BoundedProcessor2(sim);
            default:
                throw new ConfigurationException("unsupported processor type " + procType);
        }
    }

    @Override
    public Integer call() throws Exception {
        var sim = new Simulator();
        var drain = new StatsDrain();
        var processor = createProcessor(sim);
        processor.setCtxCost(ctxCost);
        processor.setRequestDrain(drain);

        var gen = createGenerator(sim, processor);
        if (colorRatio >= 0 && gen instanceof PoissonRequestGenerator) {
            ((PoissonRequestGenerator) gen).setColorRatio(colorRatio);
        }
        gen.start();
        startMonitor(sim, processor);

        log.info("Running {} processor, lambda={} mu={} duration={}", procType, lambda, mu, duration);
        sim.doAllEvents();
        log.info("Simulation finished at t={}, {} requests generated", sim.now(), gen.getGenerated());

        drain.printSummary(System.out);
        if (logFile != null) {
            drain.writeLog(logFile);
        }
        return 0;
    }
}
