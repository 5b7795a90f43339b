package edu.purdue.dsnl.procsim.processor;

import edu.purdue.dsnl.procsim.Request;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Wakeup {
    private static final Wakeup TIMEOUT = new Wakeup(false, null);

    private final boolean interrupted;

    /** The arriving request; {@code null} on timeout. */
    private final Request request;

    public static Wakeup timeout() {
        return TIMEOUT;
    }

    public static Wakeup arrival(Request request) {
        return new Wakeup(true, request);
    }
}
