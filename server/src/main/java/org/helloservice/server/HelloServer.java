package org.helloservice.server;

import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Jetty-backed HTTP service exposing {@code GET /} and {@code GET /health}.
 *
 * <p>Lifecycle is {@link State#STARTING} until {@link #start()} binds the port, then
 * {@link State#SERVING} until {@link #stop()}.
 */
public class HelloServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(HelloServer.class);

    public enum State { STARTING, SERVING, STOPPED }

    private final AppConfig config;
    private final Server httpServer;
    private final ServerConnector connector;
    private volatile State state = State.STARTING;

    public HelloServer(AppConfig config) {
        this(config, Clock.systemUTC());
    }

    public HelloServer(AppConfig config, Clock clock) {
        this.config = config;
        this.httpServer = new Server();
        this.connector = new ServerConnector(httpServer);
        connector.setHost(config.server().host());
        connector.setPort(config.server().port());
        httpServer.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.addServlet(new ServletHolder(new HealthServlet()), "/health");
        context.addServlet(new ServletHolder(new GreetingServlet(config.greeting(), clock)), "/*");
        httpServer.setHandler(context);
    }

    /**
     * Binds the listener and starts accepting requests.
     *
     * @throws StartupException if the port cannot be bound; the server is left stopped
     */
    public void start() throws StartupException {
        String host = config.server().host();
        int port = config.server().port();
        try {
            httpServer.start();
        } catch (Exception e) {
            state = State.STOPPED;
            StartupException failure = new StartupException(host, port, e);
            try {
                httpServer.stop();
            } catch (Exception stopFailure) {
                failure.addSuppressed(stopFailure);
            }
            throw failure;
        }
        state = State.SERVING;
        LOGGER.info("Server started on {}", baseUrl());
    }

    public void stop() throws Exception {
        if (state == State.STOPPED) {
            return;
        }
        state = State.STOPPED;
        httpServer.stop();
        LOGGER.info("Server stopped");
    }

    /** Blocks until the Jetty server has fully stopped. */
    public void join() throws InterruptedException {
        httpServer.join();
    }

    public State state() {
        return state;
    }

    /** The bound port, which differs from the configured one when that was {@code 0}. */
    public int port() {
        int local = connector.getLocalPort();
        return local > 0 ? local : config.server().port();
    }

    public String baseUrl() {
        return "http://" + config.server().host() + ":" + port();
    }
}
