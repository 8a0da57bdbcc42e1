package org.helloservice.server;

public record HealthResponse(String status) {

    public static final HealthResponse HEALTHY = new HealthResponse("healthy");
}
