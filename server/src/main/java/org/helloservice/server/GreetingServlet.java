package org.helloservice.server;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;

/**
 * Serves {@code GET /}. Mapped to {@code /*} so it sees every path the other servlets do
 * not claim; any method on a path other than the context root gets the container's 404 page.
 */
public class GreetingServlet extends HttpServlet {

    private static final Logger LOGGER = LoggerFactory.getLogger(GreetingServlet.class);

    private final AppConfig.GreetingConfig greeting;
    private final Clock clock;

    public GreetingServlet(AppConfig.GreetingConfig greeting, Clock clock) {
        this.greeting = greeting;
        this.clock = clock;
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
        String path = req.getPathInfo();
        if (path != null && !"/".equals(path)) {
            resp.sendError(HttpServletResponse.SC_NOT_FOUND);
            return;
        }
        super.service(req, resp);
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        GreetingResponse payload = GreetingResponse.now(greeting, clock);
        LOGGER.debug("Greeting served at {}", payload.timestamp());
        JsonUtil.writeJson(resp, HttpServletResponse.SC_OK, payload);
    }
}
