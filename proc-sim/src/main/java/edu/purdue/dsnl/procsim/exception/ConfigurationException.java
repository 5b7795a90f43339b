package edu.purdue.dsnl.procsim.exception;

public class ConfigurationException extends SimulationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
