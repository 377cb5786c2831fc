package me.reasonloop.runtime.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.reasonloop.runtime.domain.bus.EventBus;
import me.reasonloop.runtime.infrastructure.event.InMemoryEventBus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration wiring the runtime core: the shared clock and JSON
 * mapper, the handler executor and the event bus.
 *
 * <p>
 * The event bus is a single bean injected wherever it is needed. It is
 * started on creation when {@code reasonloop.event-bus.auto-start} is true and
 * stopped on shutdown.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AgentProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Unbounded so that every matching handler of an event starts at once;
     * handlers may publish and wait for a reply on the same pool.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService eventHandlerExecutor() {
        return Executors.newCachedThreadPool(daemonThreadFactory("event-handler-"));
    }

    @Bean(destroyMethod = "stop")
    public EventBus eventBus(ExecutorService eventHandlerExecutor, Clock clock) {
        AgentProperties.EventBusProperties settings = properties.getEventBus();
        InMemoryEventBus bus = new InMemoryEventBus(settings.getMaxHistorySize(), settings.getStatsWindow(),
                eventHandlerExecutor, clock);
        if (settings.isAutoStart()) {
            bus.start();
        }
        return bus;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("ReasonLoop runtime v{} starting...", version);
        log.info("Event bus history size: {}", properties.getEventBus().getMaxHistorySize());
        log.info("Default execution mode: {}, max steps: {}", properties.getAgent().getExecutionMode().getValue(),
                properties.getAgent().getMaxSteps());
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
