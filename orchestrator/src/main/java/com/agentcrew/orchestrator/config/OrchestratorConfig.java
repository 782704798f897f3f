package com.agentcrew.orchestrator.config;

import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandProcessor;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Beans that need explicit construction: the shared clock and the command processor,
 * whose lifecycle follows the application context.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Every {@code CommandHandler} bean is registered with the processor. The consumer
     * thread starts once the context is built and stops on context close.
     */
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public CommandProcessor commandProcessor(
            List<CommandHandler<?>> handlers,
            MeterRegistry meterRegistry,
            @Value("${agentcrew.processor.queue-capacity:100}") int queueCapacity,
            @Value("${agentcrew.processor.enqueue-timeout:1s}") Duration enqueueTimeout,
            @Value("${agentcrew.processor.shutdown-timeout:30s}") Duration shutdownTimeout) {
        return new CommandProcessor(handlers, meterRegistry, queueCapacity, enqueueTimeout, shutdownTimeout);
    }
}
