package org.nexus.nexusmonitor.domain;

import java.util.List;

public record SystemStatus(double uptime, SystemMetrics metrics, List<ServiceStatus> services) {}
