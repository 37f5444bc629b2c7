package com.eainde.expedition.config;

import com.eainde.expedition.thread.MdcAwareThreadPoolExecutor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * Root configuration of the diagnosis engine. Hosts import this class and provide a
 * {@link com.eainde.expedition.data.MetricsDataSource}; an
 * {@link com.eainde.expedition.action.ActionExecutionGateway} is optional.
 */
@Configuration
@ComponentScan(basePackages = "com.eainde.expedition")
@EnableConfigurationProperties(ExpeditionProperties.class)
public class ExpeditionConfiguration {

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Threads that carry the external calls of every stage, so that each call can be timed out and interrupted. */
    @Bean(name = "stageCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService stageCallExecutor() {
        return MdcAwareThreadPoolExecutor.cached("stage-call-");
    }
}
