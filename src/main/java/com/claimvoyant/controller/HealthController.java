package com.claimvoyant.controller;

import com.claimvoyant.configuration.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * Root endpoint used by load balancers and smoke tests.
 */
@RestController
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class HealthController {

    static final String SERVICE_NAME = "Claimvoyant API";

    private final AppProperties props;
    private final Clock clock;

    @GetMapping("/")
    public ServiceHealthResponse health() {
        return new ServiceHealthResponse("ok", SERVICE_NAME, props.getApiVersion(), clock.instant());
    }

    public record ServiceHealthResponse(
            String status,
            String service,
            String version,
            Instant timestamp
    ) {}
}
