package org.nexus.nexusmonitor;

import org.nexus.nexusmonitor.config.MonitoringProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MonitoringProps.class)
public class NexusMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(NexusMonitorApplication.class, args);
    }

}
