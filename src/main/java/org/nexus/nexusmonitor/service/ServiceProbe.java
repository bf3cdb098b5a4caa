package org.nexus.nexusmonitor.service;

import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.config.MonitoringProps;
import org.nexus.nexusmonitor.config.MonitoringProps.ServicesProps.ServiceEndpoint;
import org.nexus.nexusmonitor.domain.ServiceState;
import org.nexus.nexusmonitor.domain.ServiceStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Probes the health endpoint of every dependent service. Probes run in
 * parallel and each one is bounded by its own timeout, so one unreachable
 * service never delays the others.
 */
@Slf4j
@Component
public class ServiceProbe {
    private final WebClient http;
    private final List<ServiceEndpoint> endpoints;
    private final Duration timeout;
    private final Clock clock;

    public ServiceProbe(WebClient probeWebClient, MonitoringProps props, Clock clock) {
        this.http = probeWebClient;
        var services = props.services();
        this.endpoints = services == null || services.endpoints() == null ? List.of() : List.copyOf(services.endpoints());
        this.timeout = services == null || services.probeTimeout() == null ? Duration.ofSeconds(5) : services.probeTimeout();
        this.clock = clock;
    }

    /** One status per configured endpoint, in configuration order. */
    public List<ServiceStatus> probeAll() {
        if (endpoints.isEmpty()) return List.of();
        List<ServiceStatus> out = Flux.fromIterable(endpoints)
                .flatMap(this::probe, endpoints.size())
                .collectList()
                .block(timeout.plusSeconds(1));
        if (out == null) return List.of();
        var order = endpoints.stream().map(ServiceEndpoint::name).toList();
        return out.stream().sorted(Comparator.comparingInt(s -> order.indexOf(s.name()))).toList();
    }

    Mono<ServiceStatus> probe(ServiceEndpoint ep) {
        long started = clock.millis();
        return http.get().uri(ep.url())
                .exchangeToMono(resp -> resp.releaseBody().thenReturn(resp.statusCode()))
                .timeout(timeout)
                .map(code -> {
                    long rt = clock.millis() - started;
                    if (code.is2xxSuccessful()) {
                        return new ServiceStatus(ep.name(), ServiceState.RUNNING, clock.instant(), rt, null);
                    }
                    log.debug("[SystemMonitor] probe {} returned {}", ep.name(), code.value());
                    return new ServiceStatus(ep.name(), ServiceState.ERROR, clock.instant(), rt, "HTTP " + code.value());
                })
                .onErrorResume(e -> {
                    String msg = e instanceof TimeoutException ? "Timeout after " + timeout.toMillis() + " ms" : e.getMessage();
                    log.debug("[SystemMonitor] probe {} failed: {}", ep.name(), msg);
                    return Mono.just(new ServiceStatus(ep.name(), ServiceState.ERROR, clock.instant(), null, msg));
                });
    }
}
