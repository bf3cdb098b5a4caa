package org.nexus.nexusmonitor.service.dashboard;

/** No dashboard snapshot has been built yet. */
public class DashboardUnavailableException extends IllegalStateException {
    public DashboardUnavailableException(String message) {
        super(message);
    }
}
