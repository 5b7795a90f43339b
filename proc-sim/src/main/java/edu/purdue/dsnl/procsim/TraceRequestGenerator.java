package edu.purdue.dsnl.procsim;

import edu.purdue.dsnl.procsim.exception.ConfigurationException;

import tech.tablesaw.api.NumericColumn;
import tech.tablesaw.api.Table;
import tech.tablesaw.io.csv.CsvReadOptions;

/**
 * Replays a CSV trace with {@code arrival_time} and {@code service_time} columns and an optional
 * {@code color} column. Arrival times are absolute and must be non-decreasing.
 */
public class TraceRequestGenerator extends RequestGenerator {
    static final String ARRIVAL_COLUMN = "arrival_time";

    static final String SERVICE_COLUMN = "service_time";

    static final String COLOR_COLUMN = "color";

    private final double[] arrivalTimes;

    private final double[] serviceTimes;

    private final double[] colors;

    public TraceRequestGenerator(Simulator sim, RequestsAcceptable acceptor, String tracePath) {
        this(sim, acceptor, Table.read().csv(CsvReadOptions.builder(tracePath).build()));
    }

    TraceRequestGenerator(Simulator sim, RequestsAcceptable acceptor, Table trace) {
        super(sim, acceptor, Double.POSITIVE_INFINITY);
        if (!trace.containsColumn(ARRIVAL_COLUMN) || !trace.containsColumn(SERVICE_COLUMN)) {
            throw new ConfigurationException(String.format("trace needs columns %s and %s, has %s",
                    ARRIVAL_COLUMN, SERVICE_COLUMN, trace.columnNames()));
        }
        arrivalTimes = trace.numberColumn(ARRIVAL_COLUMN).asDoubleArray();
        serviceTimes = trace.numberColumn(SERVICE_COLUMN).asDoubleArray();
        colors = trace.containsColumn(COLOR_COLUMN) ? readColors(trace.numberColumn(COLOR_COLUMN)) : null;
        if (arrivalTimes.length > 0 && !(arrivalTimes[0] >= 0)) {
            throw new ConfigurationException("trace arrival time must be non-negative, got " + arrivalTimes[0]);
        }
        for (int i = 1; i < arrivalTimes.length; i++) {
            if (arrivalTimes[i] < arrivalTimes[i - 1]) {
                throw new ConfigurationException("trace arrival times are not sorted at row " + i);
            }
        }
    }

    private static double[] readColors(NumericColumn<?> column) {
        double[] values = column.asDoubleArray();
        for (int i = 0; i < values.length; i++) {
            if (column.isMissing(i) || Double.isNaN(values[i]) || values[i] != Math.rint(values[i])) {
                throw new ConfigurationException("trace color missing or not an integer at row " + i);
            }
        }
        return values;
    }

    @Override
    public void start() {
        if (arrivalTimes.length > 0) {
            super.start();
        }
    }

    @Override
    protected double getFirstArrival() {
        return arrivalTimes[0] - sim.now();
    }

    @Override
    protected Request nextRequest() {
        if (colors == null) {
            return Request.plain(time, serviceTimes[count]);
        }
        return Request.colored(time, serviceTimes[count], (int) colors[count]);
    }

    @Override
    protected double getNextInterarrival() {
        // count already points at the next row
        if (count >= arrivalTimes.length) {
            return Double.POSITIVE_INFINITY;
        }
        return arrivalTimes[count] - arrivalTimes[count - 1];
    }
}
