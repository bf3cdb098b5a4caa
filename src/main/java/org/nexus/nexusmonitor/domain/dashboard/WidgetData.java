package org.nexus.nexusmonitor.domain.dashboard;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.nexus.nexusmonitor.domain.Severity;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Payload of a dashboard widget. Each variant belongs to exactly one
 * {@link WidgetType}; the JSON form carries a {@code kind} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WidgetData.Chart.class, name = "chart"),
        @JsonSubTypes.Type(value = WidgetData.MetricCards.class, name = "metric"),
        @JsonSubTypes.Type(value = WidgetData.AlertCounts.class, name = "alert"),
        @JsonSubTypes.Type(value = WidgetData.StatusMap.class, name = "status"),
        @JsonSubTypes.Type(value = WidgetData.Table.class, name = "table")
})
public interface WidgetData {

    @JsonIgnore
    WidgetType widgetType();

    /** Latest value of each plotted series. */
    record Chart(Map<String, Double> values, Instant timestamp) implements WidgetData {
        public Chart {
            values = values == null ? Map.of() : Map.copyOf(values);
        }

        @Override public WidgetType widgetType() { return WidgetType.CHART; }
    }

    record MetricCards(Map<String, Integer> cards) implements WidgetData {
        public MetricCards {
            cards = cards == null ? Map.of() : Map.copyOf(cards);
        }

        @Override public WidgetType widgetType() { return WidgetType.METRIC; }
    }

    record AlertCounts(int total, Map<Severity, Integer> bySeverity) implements WidgetData {
        public AlertCounts {
            bySeverity = bySeverity == null ? Map.of() : Map.copyOf(bySeverity);
        }

        @Override public WidgetType widgetType() { return WidgetType.ALERT; }
    }

    record StatusMap(Map<String, DashboardData.ServiceSummary> services) implements WidgetData {
        public StatusMap {
            services = services == null ? Map.of() : Map.copyOf(services);
        }

        @Override public WidgetType widgetType() { return WidgetType.STATUS; }
    }

    record Table(List<String> columns, List<List<Object>> rows) implements WidgetData {
        public Table {
            columns = columns == null ? List.of() : List.copyOf(columns);
            rows = rows == null ? List.of() : List.copyOf(rows);
        }

        @Override public WidgetType widgetType() { return WidgetType.TABLE; }
    }
}
