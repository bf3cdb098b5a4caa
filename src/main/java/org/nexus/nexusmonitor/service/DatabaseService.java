package org.nexus.nexusmonitor.service;

import java.util.Map;

/** Persistence collaborator, consulted only by health checks. */
public interface DatabaseService {

    boolean testConnection();

    Map<String, Object> getConnectionInfo();
}
