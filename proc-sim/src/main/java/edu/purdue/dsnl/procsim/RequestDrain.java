package edu.purdue.dsnl.procsim;

public interface RequestDrain {
    void terminateRequest(Request request);
}
