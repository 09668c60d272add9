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

import com.logschema.agent.autoconfigure.observability.ObservabilityAutoConfiguration;
import com.logschema.agent.observability.context.RunContext;
import com.logschema.agent.observability.context.RunContextHolder;
import com.logschema.agent.observability.context.RunScope;
import com.logschema.agent.observability.dispatch.ObservabilityDispatcher;
import com.logschema.agent.observability.policy.LoggingStrategy;
import com.logschema.agent.observability.policy.ToolLoggingPolicy;
import com.logschema.agent.observability.tool.ToolRegistry;
import com.logschema.agent.sandbox.CapabilityGrant;
import com.logschema.agent.sandbox.CapabilitySandbox;
import com.logschema.agent.sandbox.exec.SafeCommandRunner;
import com.logschema.agent.sandbox.fs.SandboxedFileSystem;
import com.logschema.agent.sandbox.jsonl.JsonlHandleRegistry;
import com.logschema.agent.sandbox.tools.SandboxTools;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests conditional bean creation in SandboxAutoConfiguration, alone and together with
 * the observability auto-configuration.
 */
class SandboxAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SandboxAutoConfiguration.class));

    @TempDir
    Path repo;

    // --- Sandbox creation ---

    @Test
    void sandbox_shouldBeCreated_byDefault() {
        contextRunner
                .run(context -> {
                    assertThat(context).hasSingleBean(CapabilitySandbox.class);
                    assertThat(context).hasSingleBean(SandboxedFileSystem.class);
                    assertThat(context).hasSingleBean(SafeCommandRunner.class);
                    assertThat(context).hasSingleBean(JsonlHandleRegistry.class);
                    assertThat(context).hasSingleBean(SandboxTools.class);
                });
    }

    @Test
    void sandbox_shouldNotBeCreated_whenDisabled() {
        contextRunner
                .withPropertyValues("logschema.sandbox.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(CapabilitySandbox.class);
                    assertThat(context).doesNotHaveBean(SandboxTools.class);
                });
    }

    @Test
    void grant_shouldBeEmpty_whenNothingConfigured() {
        contextRunner
                .run(context -> {
                    CapabilityGrant grant = context.getBean(CapabilityGrant.class);
                    assertThat(grant.readableRoots()).isEmpty();
                    assertThat(grant.writableRoots()).isEmpty();
                    assertThat(grant.executableCommands()).isEmpty();
                    assertThat(context.getBean(CapabilitySandbox.class).checkRead(repo).allowed()).isFalse();
                });
    }

    // --- Properties binding ---

    @Test
    void grant_shouldReflectConfiguredRootsAndCommands() {
        contextRunner
                .withPropertyValues(
                        "logschema.sandbox.readable-roots=" + repo,
                        "logschema.sandbox.writable-roots=" + repo.resolve("custom_parsers"),
                        "logschema.sandbox.executable-commands=pytest,ruff",
                        "logschema.sandbox.command-timeout=5s")
                .run(context -> {
                    CapabilityGrant grant = context.getBean(CapabilityGrant.class);
                    assertThat(grant.readableRoots()).containsExactly(repo.toAbsolutePath().normalize());
                    assertThat(grant.writableRoots())
                            .containsExactly(repo.resolve("custom_parsers").toAbsolutePath().normalize());
                    assertThat(grant.executableCommands()).containsExactly("pytest", "ruff");
                    assertThat(context.getBean(SafeCommandRunner.class).getDefaultTimeout())
                            .isEqualTo(Duration.ofSeconds(5));
                });
    }

    @Test
    void grant_shouldBindCommandPoliciesAndSearchRoots() throws Exception {
        Path parser = Files.writeString(repo.resolve("nginx_parser.py"), "def parse(line): return {}\n");
        contextRunner
                .withPropertyValues(
                        "logschema.sandbox.readable-roots=" + repo,
                        "logschema.sandbox.search-roots=" + repo.resolve("logs"),
                        "logschema.sandbox.commands.python.allowed-args=--version,-m,py_compile",
                        "logschema.sandbox.commands.python.forbidden-patterns=-c,os.system",
                        "logschema.sandbox.commands.pytest.allowed-args=-v,-x",
                        "logschema.sandbox.commands.pytest.value-flags=-k")
                .run(context -> {
                    CapabilityGrant grant = context.getBean(CapabilityGrant.class);
                    assertThat(grant.effectiveSearchRoots())
                            .containsExactly(repo.resolve("logs").toAbsolutePath().normalize());
                    assertThat(grant.executableCommands()).containsExactlyInAnyOrder("python", "pytest");
                    CapabilitySandbox sandbox = context.getBean(CapabilitySandbox.class);
                    assertThat(sandbox.checkExecute("python", List.of("-m", "py_compile", parser.toString()))
                            .allowed()).isTrue();
                    assertThat(sandbox.checkExecute("python", List.of("-c", "import os")).allowed()).isFalse();
                    assertThat(sandbox.checkExecute("pytest", List.of("-k", "access", "-v")).allowed()).isTrue();
                    assertThat(sandbox.checkExecute("pytest", List.of("-p", "evil_plugin")).allowed()).isFalse();
                });
    }

    // --- With observability ---

    @Test
    void sandboxTools_shouldBeRegisteredWithObservability() {
        contextRunner
                .withConfiguration(AutoConfigurations.of(ObservabilityAutoConfiguration.class))
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    ToolRegistry registry = context.getBean(ToolRegistry.class);
                    assertThat(registry.names()).contains(
                            SandboxTools.READ_FILE_CONTENT, SandboxTools.WRITE_FILE_CONTENT,
                            SandboxTools.RUN_SAFE_COMMAND, SandboxTools.READ_JSONL,
                            SandboxTools.FIND_SIMILAR_FILES);
                    ToolLoggingPolicy policy = context.getBean(ToolLoggingPolicy.class);
                    assertThat(policy.strategyFor(SandboxTools.WRITE_FILE_CONTENT))
                            .isEqualTo(LoggingStrategy.METADATA_ONLY);
                    assertThat(policy.strategyFor(SandboxTools.READ_FILE_CONTENT))
                            .isEqualTo(LoggingStrategy.TRUNCATE);
                });
    }

    @Test
    void toolPolicies_shouldOverrideSandboxToolStrategy() {
        contextRunner
                .withConfiguration(AutoConfigurations.of(ObservabilityAutoConfiguration.class))
                .withPropertyValues("logschema.observability.tool-policies.read_file_content=metadata_only")
                .run(context -> {
                    ToolLoggingPolicy policy = context.getBean(ToolLoggingPolicy.class);
                    assertThat(policy.strategyFor(SandboxTools.READ_FILE_CONTENT))
                            .isEqualTo(LoggingStrategy.METADATA_ONLY);
                });
    }

    @Test
    void jsonlHandles_shouldReportToDispatcher() throws Exception {
        Files.writeString(repo.resolve("events.jsonl"), "{\"a\":1}\n{\"a\":2}\n");
        contextRunner
                .withConfiguration(AutoConfigurations.of(ObservabilityAutoConfiguration.class))
                .withPropertyValues("logschema.sandbox.readable-roots=" + repo)
                .run(context -> {
                    JsonlHandleRegistry handles = context.getBean(JsonlHandleRegistry.class);
                    ObservabilityDispatcher dispatcher = context.getBean(ObservabilityDispatcher.class);
                    RunContext run = RunContextHolder.newRun(Clock.systemUTC());
                    try (RunScope ignored = RunContextHolder.activate(run)) {
                        String handleId = handles.open(repo.resolve("events.jsonl"));
                        assertThat(dispatcher.openInvocations(run.runId())).isEqualTo(1);
                        assertThat(handles.readLines(handleId, 5)).hasSize(2);
                        assertThat(handles.close(handleId)).isEqualTo(2);
                        assertThat(dispatcher.openInvocations(run.runId())).isZero();
                    }
                });
    }

    @Test
    void jsonlHandles_shouldBeClosed_onContextClose() throws Exception {
        Files.writeString(repo.resolve("events.jsonl"), "{}\n");
        contextRunner
                .withPropertyValues("logschema.sandbox.readable-roots=" + repo)
                .run(context -> {
                    JsonlHandleRegistry handles = context.getBean(JsonlHandleRegistry.class);
                    handles.open(repo.resolve("events.jsonl"));
                    assertThat(handles.openHandles()).hasSize(1);
                    context.close();
                    assertThat(handles.openHandles()).isEmpty();
                });
    }
}
