package edu.purdue.dsnl.procsim;

public enum ProcessorType {
    RTC,
    TS,
    PS,
    LIMITED_PS,
    BOUNDED2,
}
