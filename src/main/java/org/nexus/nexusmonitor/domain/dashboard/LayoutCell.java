package org.nexus.nexusmonitor.domain.dashboard;

/** Grid position of a widget on a 12-column layout. */
public record LayoutCell(String id, int x, int y, int w, int h) {}
