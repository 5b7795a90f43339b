package edu.purdue.dsnl.procsim;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Cleanup;
import lombok.Getter;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Monitor requests only contribute their sampled depth, never a latency. */
public class StatsDrain implements RequestDrain {

    private final List<Request> log = new ArrayList<>();

    private final DoubleArrayList latencies = new DoubleArrayList();

    private final IntArrayList monitorDepths = new IntArrayList();

    @Getter private int dropped;

    @Override
    public void terminateRequest(Request request) {
        log.add(request);
        if (request.isDropped()) {
            dropped++;
            return;
        }
        if (request.getKind() == Request.Kind.MONITOR) {
            if (request.getSampledQueueDepth() != null) {
                monitorDepths.add(request.getSampledQueueDepth().intValue());
            }
            return;
        }
        latencies.add(request.getLatency());
    }

    public List<Request> getTerminated() {
        return Collections.unmodifiableList(log);
    }

    public int getCompleted() {
        return latencies.size();
    }

    public double meanLatency() {
        if (latencies.isEmpty()) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = 0; i < latencies.size(); i++) {
            sum += latencies.getDouble(i);
        }
        return sum / latencies.size();
    }

    /** Nearest-rank percentile of completed-request latency, {@code p} in (0, 100]. */
    public double percentileLatency(double p) {
        if (latencies.isEmpty()) {
            return Double.NaN;
        }
        double[] sorted = latencies.toDoubleArray();
        Arrays.sort(sorted);
        int rank = (int) Math.ceil(p / 100 * sorted.length);
        return sorted[Math.max(rank, 1) - 1];
    }

    public double meanMonitorDepth() {
        if (monitorDepths.isEmpty()) {
            return Double.NaN;
        }
        long sum = 0;
        for (int i = 0; i < monitorDepths.size(); i++) {
            sum += monitorDepths.getInt(i);
        }
        return (double) sum / monitorDepths.size();
    }

    public void printSummary(PrintStream out) {
        out.println("completed\tdropped\tmean\tp50\tp90\tp99\tmonitorDepth");
        out.format("%d\t%d\t%f\t%f\t%f\t%f\t%f\n", getCompleted(), dropped, meanLatency(),
                percentileLatency(50), percentileLatency(90), percentileLatency(99), meanMonitorDepth());
    }

    public void writeLog(File logFile) throws IOException {
        var mapper = new CsvMapper();
        var schema = mapper.schemaFor(Request.class).withHeader();
        @Cleanup var writer = mapper.writer(schema).writeValues(logFile);
        writer.writeAll(log);
    }
}
