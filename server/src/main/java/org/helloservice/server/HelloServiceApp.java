package org.helloservice.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public class HelloServiceApp {

    private static final Logger LOGGER = initLogger();
    private static final String DEFAULT_CONFIG_PATH = "./config.yaml";

    private static Logger initLogger() {
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "info");
        System.setProperty("org.slf4j.simpleLogger.showDateTime", "true");
        System.setProperty("org.slf4j.simpleLogger.dateTimeFormat", "yyyy-MM-dd HH:mm:ss.SSS");
        return LoggerFactory.getLogger(HelloServiceApp.class);
    }

    public static void main(String[] args) {
        int status = launch(args, System.getenv());
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Loads configuration from {@code args} and {@code env}, then serves until shutdown.
     *
     * @return the process exit status, 1 when the configuration cannot be loaded
     */
    static int launch(String[] args, Map<String, String> env) {
        Args parsed = Args.parse(args);
        AppConfig config;
        try {
            config = AppConfig.load(Path.of(parsed.configPath), parsed.explicitConfig, env);
        } catch (IOException e) {
            LOGGER.error("Failed to load configuration: {}", e.getMessage());
            return 1;
        }
        return run(new HelloServer(config));
    }

    /**
     * Starts {@code server} and blocks until it stops.
     *
     * @return the process exit status: 0 after a graceful shutdown, 1 if the server never came up
     */
    static int run(HelloServer server) {
        try {
            server.start();
        } catch (StartupException e) {
            LOGGER.error("Startup failed: {}", e.getMessage(), e);
            return 1;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.stop();
            } catch (Exception e) {
                LOGGER.warn("Failed to stop HTTP server cleanly: {}", e.getMessage());
            }
        }));

        try {
            server.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while serving; shutting down");
        }
        return 0;
    }

    record Args(String configPath, boolean explicitConfig) {
        static Args parse(String[] args) {
            String configPath = DEFAULT_CONFIG_PATH;
            boolean explicitConfig = false;
            if (args != null) {
                for (int i = 0; i < args.length; i++) {
                    String arg = args[i];
                    if (arg == null) {
                        continue;
                    }
                    if (arg.startsWith("--config=")) {
                        configPath = arg.substring("--config=".length());
                        explicitConfig = true;
                        continue;
                    }
                    if ("--config".equals(arg) && i + 1 < args.length) {
                        configPath = args[++i];
                        explicitConfig = true;
                    }
                }
            }
            return new Args(configPath, explicitConfig);
        }
    }
}
