package org.nexus.nexusmonitor.api.dto;

import jakarta.validation.constraints.Size;

public record ResolveRequest(@Size(max = 120) String resolvedBy) {}
