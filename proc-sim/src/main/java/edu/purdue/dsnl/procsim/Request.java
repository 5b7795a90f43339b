package edu.purdue.dsnl.procsim;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import edu.purdue.dsnl.procsim.exception.ConfigurationException;
import edu.purdue.dsnl.procsim.exception.InvariantViolationException;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@ToString
@JsonPropertyOrder({"requestId", "kind", "color", "arrivalTime", "serviceTime", "timeComplete",
        "dropped", "sampledQueueDepth"})
public class Request {
    private static int requestIdCounter = 0;

    public enum Kind {
        PLAIN,
        COLORED,
        /** Samples a queue depth on its way through. */
        MONITOR,
    }

    private final int requestId = requestIdCounter++;

    private final double arrivalTime;

    private final double serviceTime;

    private final Kind kind;

    /** Only meaningful for {@link Kind#COLORED}. */
    private final int color;

    @JsonIgnore private double remainingService;

    private Integer sampledQueueDepth;

    private double timeComplete = Double.NaN;

    @Setter private boolean dropped;

    @JsonIgnore private boolean terminated;

    private Request(double arrivalTime, double serviceTime, Kind kind, int color) {
        if (Double.isNaN(serviceTime) || serviceTime < 0) {
            throw new ConfigurationException("service time must be non-negative, got " + serviceTime);
        }
        this.arrivalTime = arrivalTime;
        this.serviceTime = serviceTime;
        this.remainingService = serviceTime;
        this.kind = kind;
        this.color = color;
    }

    public static Request plain(double arrivalTime, double serviceTime) {
        return new Request(arrivalTime, serviceTime, Kind.PLAIN, -1);
    }

    public static Request colored(double arrivalTime, double serviceTime, int color) {
        return new Request(arrivalTime, serviceTime, Kind.COLORED, color);
    }

    public static Request monitor(double arrivalTime, double serviceTime) {
        return new Request(arrivalTime, serviceTime, Kind.MONITOR, -1);
    }

    /** Removes served time; drift below zero is clamped. */
    public void subServiceTime(double amount) {
        remainingService = Math.max(0.0, remainingService - amount);
    }

    public void recordQueueDepth(int depth) {
        if (sampledQueueDepth != null) {
            throw new InvariantViolationException(
                    "queue depth already sampled for request " + requestId);
        }
        sampledQueueDepth = depth;
    }

    /** Marks the end of this request's life. Called once, by the processor handing it to a drain. */
    public void markTerminated(double time) {
        if (terminated) {
            throw new InvariantViolationException("request " + requestId + " terminated twice");
        }
        terminated = true;
        timeComplete = time;
    }

    @JsonIgnore
    public double getLatency() {
        return timeComplete - arrivalTime;
    }
}
