package org.nexus.nexusmonitor.domain.dashboard;

import java.time.Instant;

public record DashboardStats(int totalWidgets, Instant lastUpdate, boolean running) {}
