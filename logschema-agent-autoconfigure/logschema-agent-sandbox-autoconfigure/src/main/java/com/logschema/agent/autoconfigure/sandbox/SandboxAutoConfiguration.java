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
package com.logschema.agent.autoconfigure.sandbox;

import com.logschema.agent.observability.dispatch.LifecycleListener;
import com.logschema.agent.observability.dispatch.ObservabilityDispatcher;
import com.logschema.agent.sandbox.CapabilityGrant;
import com.logschema.agent.sandbox.CapabilitySandbox;
import com.logschema.agent.sandbox.SandboxProperties;
import com.logschema.agent.sandbox.exec.SafeCommandRunner;
import com.logschema.agent.sandbox.fs.SandboxedFileSystem;
import com.logschema.agent.sandbox.jsonl.JsonlHandleRegistry;
import com.logschema.agent.sandbox.tools.SandboxTools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration of the capability sandbox and the agent tools built on it.
 *
 * <p>The grant comes from {@code logschema.sandbox.*}. With nothing configured every
 * file access and command is denied.
 *
 * @see SandboxProperties
 */
@AutoConfiguration(afterName = "com.logschema.agent.autoconfigure.observability.ObservabilityAutoConfiguration")
@EnableConfigurationProperties(SandboxProperties.class)
@ConditionalOnProperty(prefix = "logschema.sandbox", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SandboxAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SandboxAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CapabilityGrant capabilityGrant(SandboxProperties properties) {
        CapabilityGrant grant = properties.toGrant();
        log.info("Configuring agent sandbox (readable: {}, writable: {}, search: {}, commands: {})",
                grant.readableRoots(), grant.writableRoots(), grant.effectiveSearchRoots(),
                grant.executableCommands());
        return grant;
    }

    @Bean
    @ConditionalOnMissingBean
    public CapabilitySandbox capabilitySandbox(CapabilityGrant capabilityGrant) {
        return new CapabilitySandbox(capabilityGrant);
    }

    @Bean
    @ConditionalOnMissingBean
    public SandboxedFileSystem sandboxedFileSystem(CapabilitySandbox capabilitySandbox) {
        return new SandboxedFileSystem(capabilitySandbox);
    }

    @Bean
    @ConditionalOnMissingBean
    public SafeCommandRunner safeCommandRunner(CapabilitySandbox capabilitySandbox, SandboxProperties properties) {
        return new SafeCommandRunner(capabilitySandbox, properties.getCommandTimeout());
    }

    /**
     * Registry of open JSONL handles. Handle events reach the dispatcher when one is
     * configured; it is looked up per notification since the dispatcher itself depends
     * on the tools built from this registry.
     *
     * @param capabilitySandbox the sandbox
     * @param dispatcher        the dispatcher, if any
     * @return the registry
     */
    @Bean(destroyMethod = "closeAll")
    @ConditionalOnMissingBean
    public JsonlHandleRegistry jsonlHandleRegistry(CapabilitySandbox capabilitySandbox,
                                                   ObjectProvider<ObservabilityDispatcher> dispatcher) {
        LifecycleListener listener = notification -> dispatcher.ifAvailable(d -> d.onLifecycle(notification));
        return new JsonlHandleRegistry(capabilitySandbox, listener);
    }

    @Bean
    @ConditionalOnMissingBean
    public SandboxTools sandboxTools(SandboxedFileSystem sandboxedFileSystem, SafeCommandRunner safeCommandRunner,
                                     JsonlHandleRegistry jsonlHandleRegistry) {
        log.info("Registering sandboxed file, command and JSONL tools");
        return new SandboxTools(sandboxedFileSystem, safeCommandRunner, jsonlHandleRegistry);
    }
}
