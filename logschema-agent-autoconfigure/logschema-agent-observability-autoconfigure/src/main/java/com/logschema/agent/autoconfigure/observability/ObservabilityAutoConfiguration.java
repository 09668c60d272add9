/*
 * Copyright 2025-2026 The LogSchema Agent Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.logschema.agent.autoconfigure.observability;

import com.logschema.agent.observability.ObservabilityProperties;
import com.logschema.agent.observability.context.RunContextTaskDecorator;
import com.logschema.agent.observability.dispatch.ObservabilityDispatcher;
import com.logschema.agent.observability.emit.AsyncEventSink;
import com.logschema.agent.observability.emit.EventDestination;
import com.logschema.agent.observability.emit.EventRenderer;
import com.logschema.agent.observability.emit.EventSink;
import com.logschema.agent.observability.emit.MetricEventEmitter;
import com.logschema.agent.observability.emit.MetricEventListener;
import com.logschema.agent.observability.emit.Slf4jEventSink;
import com.logschema.agent.observability.event.MonotonicClock;
import com.logschema.agent.observability.ledger.TokenLedger;
import com.logschema.agent.observability.metrics.ObservabilityMetricsListener;
import com.logschema.agent.observability.policy.ToolLoggingPolicy;
import com.logschema.agent.observability.tool.ToolCatalog;
import com.logschema.agent.observability.tool.ToolExecutor;
import com.logschema.agent.observability.tool.ToolRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Auto-configuration for agent run observability.
 *
 * <p>Wires the run event pipeline: lifecycle notifications reach the
 * {@link ObservabilityDispatcher}, which builds events and hands them to the
 * {@link MetricEventEmitter} for the console and file destinations.
 *
 * @see ObservabilityProperties
 */
@AutoConfiguration(
        afterName = {
                "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
                "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
        }
)
@EnableConfigurationProperties(ObservabilityProperties.class)
@ConditionalOnProperty(prefix = "logschema.observability", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ObservabilityAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ObservabilityAutoConfiguration.class);

    /**
     * Accepts log level names as verbosity values in configuration.
     *
     * @return the converter
     */
    @Bean
    @ConfigurationPropertiesBinding
    public static VerbosityConverter verbosityConverter() {
        return new VerbosityConverter();
    }

    /**
     * Clock stamping every event of every run.
     *
     * @return a monotonic UTC clock
     */
    @Bean
    @ConditionalOnMissingBean
    public MonotonicClock observabilityClock() {
        return MonotonicClock.systemUTC();
    }

    /**
     * Registry of every tool contributed by a {@link ToolCatalog} bean.
     *
     * @param catalogs the catalogs
     * @return the registry
     */
    @Bean
    @ConditionalOnMissingBean
    public ToolRegistry toolRegistry(ObjectProvider<ToolCatalog> catalogs) {
        ToolRegistry registry = ToolRegistry.fromCatalogs(catalogs.orderedStream().toList());
        log.info("Registered {} agent tools", registry.names().size());
        return registry;
    }

    /**
     * Tool logging policy derived from the registered tools and configured overrides.
     *
     * @param registry   the registered tools
     * @param properties the observability properties
     * @return the policy
     */
    @Bean
    @ConditionalOnMissingBean
    public ToolLoggingPolicy toolLoggingPolicy(ToolRegistry registry, ObservabilityProperties properties) {
        return ToolLoggingPolicy.from(registry, properties.getToolPolicies(), properties.isRequireRegisteredTools());
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenLedger tokenLedger(MonotonicClock observabilityClock) {
        return new TokenLedger(observabilityClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventRenderer eventRenderer(ObservabilityProperties properties) {
        return new EventRenderer(properties.getMaxFieldLength());
    }

    /**
     * Sink of the console destination, logger {@value Slf4jEventSink#CONSOLE_LOGGER}.
     *
     * @param properties the observability properties
     * @return the sink, asynchronous if configured
     */
    @Bean
    @ConditionalOnMissingBean(name = "consoleEventSink")
    public EventSink consoleEventSink(ObservabilityProperties properties) {
        return maybeAsync(Slf4jEventSink.console(), properties, "logschema-console-writer-");
    }

    /**
     * Sink of the file destination, logger {@value Slf4jEventSink#FILE_LOGGER}.
     *
     * @param properties the observability properties
     * @return the sink, asynchronous if configured
     */
    @Bean
    @ConditionalOnMissingBean(name = "fileEventSink")
    public EventSink fileEventSink(ObservabilityProperties properties) {
        return maybeAsync(Slf4jEventSink.file(), properties, "logschema-file-writer-");
    }

    /**
     * Emitter writing to the console and file destinations at their configured verbosity.
     */
    @Bean
    @ConditionalOnMissingBean
    public MetricEventEmitter metricEventEmitter(
            @Qualifier("consoleEventSink") EventSink consoleEventSink,
            @Qualifier("fileEventSink") EventSink fileEventSink,
            EventRenderer eventRenderer,
            ToolLoggingPolicy toolLoggingPolicy,
            ObservabilityProperties properties,
            ObjectProvider<MetricEventListener> listeners) {
        log.info("Configuring agent event emission (console: {}, file: {})",
                properties.getConsoleVerbosity(), properties.getFileVerbosity());
        return new MetricEventEmitter(
                List.of(new EventDestination("console", properties.getConsoleVerbosity(), consoleEventSink),
                        new EventDestination("file", properties.getFileVerbosity(), fileEventSink)),
                eventRenderer, toolLoggingPolicy, listeners.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public ObservabilityDispatcher observabilityDispatcher(MetricEventEmitter emitter, TokenLedger ledger,
                                                           ToolLoggingPolicy policy, MonotonicClock observabilityClock) {
        return new ObservabilityDispatcher(emitter, ledger, policy, observabilityClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolExecutor toolExecutor(ToolRegistry registry, ObservabilityDispatcher dispatcher) {
        return new ToolExecutor(registry, dispatcher);
    }

    /**
     * Task decorator carrying the active run into executor threads. Apply it to any
     * executor that runs work on behalf of an agent run.
     *
     * @return the decorator
     */
    @Bean
    @ConditionalOnMissingBean
    public RunContextTaskDecorator runContextTaskDecorator() {
        return new RunContextTaskDecorator();
    }

    /**
     * Creates the Micrometer metrics listener.
     *
     * @param meterRegistry the meter registry
     * @param properties    the observability properties
     * @return the metrics listener
     */
    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "logschema.observability", name = "metrics-enabled",
            havingValue = "true", matchIfMissing = true)
    public ObservabilityMetricsListener observabilityMetricsListener(
            MeterRegistry meterRegistry, ObservabilityProperties properties) {
        log.info("Configuring agent Micrometer metrics listener");
        return new ObservabilityMetricsListener(meterRegistry, properties);
    }

    private static EventSink maybeAsync(EventSink sink, ObservabilityProperties properties, String threadPrefix) {
        if (!properties.isAsyncEmission()) {
            return sink;
        }
        log.debug("Writing events asynchronously with queue capacity {}", properties.getAsyncQueueCapacity());
        return new AsyncEventSink(sink, properties.getAsyncQueueCapacity(), threadPrefix);
    }
}
