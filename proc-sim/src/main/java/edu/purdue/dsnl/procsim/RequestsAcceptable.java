package edu.purdue.dsnl.procsim;

import java.util.List;

public interface RequestsAcceptable {
    void acceptRequest(Request request);

    /** Requests arriving at the same instant, delivered in list order. */
    default void acceptRequests(List<Request> requests) {
        for (Request r : requests) {
            acceptRequest(r);
        }
    }

    /** Number of requests waiting at the input, excluding those in service. */
    int queueLength();
}
