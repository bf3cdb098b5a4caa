package org.nexus.nexusmonitor.config;

import org.nexus.nexusmonitor.domain.AlertType;
import org.nexus.nexusmonitor.domain.Severity;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Locale;

/** Query parameters accept enum names in any case (?severity=high). */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, Severity.class,
                s -> Severity.valueOf(s.trim().toUpperCase(Locale.ROOT)));
        registry.addConverter(String.class, AlertType.class,
                s -> AlertType.valueOf(s.trim().toUpperCase(Locale.ROOT)));
    }
}
