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
package com.logschema.agent.sandbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CommandPolicy}.
 */
class CommandPolicyTest {

    private final CommandPolicy pytest = CommandPolicy.of(
            List.of("-v", "-x", "--tb=short"), List.of("-k"), List.of("--rootdir"));

    // ================================================================================
    // ALLOWED ARGUMENT TESTS
    // ================================================================================

    @Nested
    @DisplayName("Allowed Argument Tests")
    class AllowedArgumentTests {

        @Test
        @DisplayName("Listed flags and path arguments should be accepted")
        void violation_listedFlags_shouldBeEmpty() {
            assertThat(pytest.violation(List.of("-v", "-x", "custom_parsers/test_nginx.py"))).isEmpty();
        }

        @Test
        @DisplayName("Flag with an inline value should match its listed name")
        void violation_inlineValue_shouldBeEmpty() {
            CommandPolicy policy = CommandPolicy.of(List.of("--tb"), List.of(), List.of());

            assertThat(policy.violation(List.of("--tb=long"))).isEmpty();
        }

        @Test
        @DisplayName("Value after a value flag should pass through")
        void violation_valueFlagValue_shouldBeEmpty() {
            assertThat(pytest.violation(List.of("-k", "access and not error"))).isEmpty();
        }

        @Test
        @DisplayName("Value flag as the last argument should be accepted")
        void violation_trailingValueFlag_shouldBeEmpty() {
            assertThat(pytest.violation(List.of("-v", "-k"))).isEmpty();
        }

        @Test
        @DisplayName("Numbers should be accepted without a listing")
        void violation_number_shouldBeEmpty() {
            assertThat(CommandPolicy.pathsOnly().violation(List.of("10"))).isEmpty();
        }

        @Test
        @DisplayName("Any-arguments policy should accept unlisted words")
        void violation_anyArguments_shouldBeEmpty() {
            assertThat(CommandPolicy.anyArguments(List.of()).violation(List.of("parsers", "ready"))).isEmpty();
        }
    }

    // ================================================================================
    // DENIED ARGUMENT TESTS
    // ================================================================================

    @Nested
    @DisplayName("Denied Argument Tests")
    class DeniedArgumentTests {

        @ParameterizedTest
        @ValueSource(strings = {"-p", "-q", "--co", "--import-mode=append", "-vv"})
        @DisplayName("Unlisted flags should be refused")
        void violation_unlistedFlag_shouldExplain(String flag) {
            assertThat(pytest.violation(List.of(flag)))
                    .hasValueSatisfying(reason -> assertThat(reason)
                            .contains("'" + flag + "' not allowed")
                            .contains("-v"));
        }

        @Test
        @DisplayName("Forbidden pattern should be refused even after a value flag")
        void violation_forbiddenPatternAfterValueFlag_shouldExplain() {
            assertThat(pytest.violation(List.of("-k", "--rootdir=..")))
                    .hasValueSatisfying(reason -> assertThat(reason).contains("forbidden pattern '--rootdir'"));
        }

        @Test
        @DisplayName("Forbidden pattern should be refused for any-arguments policies")
        void violation_forbiddenPatternAnyArguments_shouldExplain() {
            CommandPolicy python = CommandPolicy.anyArguments(List.of("-c", "os.system"));

            assertThat(python.violation(List.of("-c", "print(1)"))).isPresent();
            assertThat(python.violation(List.of("script.py", "os.system('id')"))).isPresent();
        }

        @Test
        @DisplayName("Plain words should be refused by the default policy")
        void violation_pathsOnlyWord_shouldExplain() {
            assertThat(CommandPolicy.pathsOnly().violation(List.of("evil_plugin"))).isPresent();
        }
    }

    // ================================================================================
    // CONSTRUCTION TESTS
    // ================================================================================

    @Nested
    @DisplayName("Construction Tests")
    class ConstructionTests {

        @Test
        @DisplayName("Blank entries should be rejected")
        void of_blankEntry_shouldThrow() {
            assertThatThrownBy(() -> CommandPolicy.of(List.of(" "), List.of(), List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Null lists should be treated as empty")
        void of_nullLists_shouldBeEmpty() {
            CommandPolicy policy = CommandPolicy.of(null, null, null);

            assertThat(policy.allowedArgs()).isEmpty();
            assertThat(policy.valueFlags()).isEmpty();
            assertThat(policy.forbiddenPatterns()).isEmpty();
        }

        @ParameterizedTest
        @ValueSource(strings = {"logs/app.log", "events.jsonl", "parser.py", "NOTES.TXT"})
        @DisplayName("File-like arguments should be treated as paths")
        void isPathArgument_fileLike_shouldBeTrue(String arg) {
            assertThat(CommandPolicy.isPathArgument(arg)).isTrue();
        }
    }
}
