package org.nexus.nexusmonitor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class MonitoringConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Alert notifications run here, off the caller's thread and after the alert is stored. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService alertNotificationExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "alert-notifier");
            t.setDaemon(true);
            return t;
        });
    }
}
