package com.triagedesk.support.common.config;

import com.triagedesk.support.desk.service.routing.RoutingProperties;
import com.triagedesk.support.desk.service.routing.RoutingTables;
import com.triagedesk.support.desk.service.sla.EscalationProperties;
import com.triagedesk.support.desk.service.sla.EscalationThresholds;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class DeskConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RoutingTables routingTables(RoutingProperties properties) {
        return properties.toTables();
    }

    @Bean
    public EscalationThresholds escalationThresholds(EscalationProperties properties) {
        return properties.toThresholds();
    }

    /**
     * Background pool for classification write-back; never used on the request path.
     */
    @Bean(name = "classificationExecutor")
    public ThreadPoolTaskExecutor classificationExecutor(@Value("${app.classifier.pool-size:4}") int poolSize) {
        var size = Math.max(1, Math.min(poolSize, 64));
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("classify-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
