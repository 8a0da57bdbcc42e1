package org.helloservice.server;

/**
 * Raised when the HTTP listener cannot be brought up, most often because the port is
 * already bound or needs privileges the process lacks.
 */
public class StartupException extends Exception {

    private final String host;
    private final int port;

    public StartupException(String host, int port, Throwable cause) {
        super("Failed to bind " + host + ":" + port + ": " + cause.getMessage(), cause);
        this.host = host;
        this.port = port;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }
}
