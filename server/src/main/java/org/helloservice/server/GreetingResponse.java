package org.helloservice.server;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public record GreetingResponse(String message, String version, String timestamp) {

    // Always three fractional digits and a literal Z, e.g. 2024-01-01T00:00:00.000Z
    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    public static GreetingResponse now(AppConfig.GreetingConfig greeting, Clock clock) {
        return new GreetingResponse(greeting.message(), greeting.version(),
                TIMESTAMP_FORMAT.format(clock.instant()));
    }
}
