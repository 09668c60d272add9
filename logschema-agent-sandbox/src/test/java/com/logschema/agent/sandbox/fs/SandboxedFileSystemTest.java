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
package com.logschema.agent.sandbox.fs;

import com.logschema.agent.sandbox.CapabilityGrant;
import com.logschema.agent.sandbox.CapabilitySandbox;
import com.logschema.agent.sandbox.SandboxViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SandboxedFileSystem}.
 */
class SandboxedFileSystemTest {

    @TempDir
    Path tmp;

    private Path repo;
    private Path parsers;
    private Path outside;
    private SandboxedFileSystem fileSystem;

    @BeforeEach
    void setUp() throws Exception {
        repo = Files.createDirectories(tmp.resolve("repo"));
        parsers = Files.createDirectories(repo.resolve("custom_parsers"));
        Files.createDirectories(repo.resolve("logs/nested"));
        Files.writeString(repo.resolve("logs/app.log"), "a\nb\nc\n");
        Files.writeString(repo.resolve("logs/nested/db.log"), "x\n");
        Files.writeString(repo.resolve("logs/notes.txt"), "n\n");
        outside = Files.createDirectories(tmp.resolve("outside"));
        Files.writeString(outside.resolve("secret.log"), "s3cr3t\n");
        fileSystem = new SandboxedFileSystem(new CapabilitySandbox(
                new CapabilityGrant(List.of(repo), List.of(parsers), Set.of())));
    }

    // ================================================================================
    // READ TESTS
    // ================================================================================

    @Nested
    @DisplayName("Read Tests")
    class ReadTests {

        @Test
        @DisplayName("Read should return content, capped by max lines")
        void readFile_shouldHonorMaxLines() throws Exception {
            assertThat(fileSystem.readFile(repo.resolve("logs/app.log"), 0)).isEqualTo("a\nb\nc\n");
            assertThat(fileSystem.readFile(repo.resolve("logs/app.log"), 2)).isEqualTo("a\nb");
        }

        @Test
        @DisplayName("Read outside the sandbox should throw a violation")
        void readFile_outside_shouldThrow() {
            assertThatThrownBy(() -> fileSystem.readFile(outside.resolve("secret.log"), 0))
                    .isInstanceOf(SandboxViolationException.class);
        }

        @Test
        @DisplayName("Line count should count lines")
        void lineCount_shouldCountLines() throws Exception {
            assertThat(fileSystem.lineCount(repo.resolve("logs/app.log"))).isEqualTo(3);
        }
    }

    // ================================================================================
    // WRITE TESTS
    // ================================================================================

    @Nested
    @DisplayName("Write Tests")
    class WriteTests {

        @Test
        @DisplayName("Write should create the file under the writable root")
        void writeFile_shouldCreate() throws Exception {
            Path written = fileSystem.writeFile(parsers.resolve("nginx.py"), "def parse(): pass\n", false);

            assertThat(written).isEqualTo(parsers.toRealPath().resolve("nginx.py"));
            assertThat(Files.readString(written)).isEqualTo("def parse(): pass\n");
        }

        @Test
        @DisplayName("Existing file should only be replaced with overwrite")
        void writeFile_existing_shouldRequireOverwrite() throws Exception {
            fileSystem.writeFile(parsers.resolve("nginx.py"), "v1", false);

            assertThatThrownBy(() -> fileSystem.writeFile(parsers.resolve("nginx.py"), "v2", false))
                    .isInstanceOf(FileAlreadyExistsException.class);
            fileSystem.writeFile(parsers.resolve("nginx.py"), "v2", true);
            assertThat(Files.readString(parsers.resolve("nginx.py"))).isEqualTo("v2");
        }

        @Test
        @DisplayName("Write to a readable-only location should throw a violation")
        void writeFile_readOnly_shouldThrow() throws Exception {
            assertThatThrownBy(() -> fileSystem.writeFile(repo.resolve("logs/app.log"), "x", true))
                    .isInstanceOf(SandboxViolationException.class);
            assertThat(Files.readString(repo.resolve("logs/app.log"))).isEqualTo("a\nb\nc\n");
        }

        @Test
        @DisplayName("Overwrite through a link leaving the writable root should be denied")
        void writeFile_overwriteThroughLink_shouldBeDenied() throws Exception {
            Files.createSymbolicLink(parsers.resolve("nginx.py"), outside.resolve("secret.log"));

            assertThatThrownBy(() -> fileSystem.writeFile(parsers.resolve("nginx.py"), "x", true))
                    .isInstanceOf(SandboxViolationException.class);
            assertThat(Files.readString(outside.resolve("secret.log"))).isEqualTo("s3cr3t\n");
        }

        @Test
        @DisplayName("Replacing a target swapped for a link should replace the link, not its target")
        void replace_afterSwapToLink_shouldNotWriteThroughLink() throws Exception {
            Path real = fileSystem.writeFile(parsers.resolve("nginx.py"), "v1", false);
            Files.delete(real);
            Files.createSymbolicLink(real, outside.resolve("secret.log"));

            SandboxedFileSystem.replace(real, "v2");

            assertThat(Files.isSymbolicLink(real)).isFalse();
            assertThat(Files.readString(real)).isEqualTo("v2");
            assertThat(Files.readString(outside.resolve("secret.log"))).isEqualTo("s3cr3t\n");
        }

        @Test
        @DisplayName("Overwrite should leave no temporary files behind")
        void writeFile_overwrite_shouldLeaveNoTemporaryFiles() throws Exception {
            fileSystem.writeFile(parsers.resolve("nginx.py"), "v1", false);
            fileSystem.writeFile(parsers.resolve("nginx.py"), "v2", true);

            try (var entries = Files.list(parsers)) {
                assertThat(entries.map(path -> path.getFileName().toString())).containsExactly("nginx.py");
            }
        }
    }

    // ================================================================================
    // LISTING AND SEARCH TESTS
    // ================================================================================

    @Nested
    @DisplayName("Listing And Search Tests")
    class ListingAndSearchTests {

        @Test
        @DisplayName("Listing should be sorted and filtered by glob")
        void listDirectory_shouldFilter() throws Exception {
            Path logs = repo.resolve("logs").toRealPath();

            assertThat(fileSystem.listDirectory(repo.resolve("logs"), "*.log", false))
                    .containsExactly(logs.resolve("app.log"));
            assertThat(fileSystem.listDirectory(repo.resolve("logs"), null, true))
                    .containsExactly(logs.resolve("app.log"), logs.resolve("notes.txt"));
            assertThat(fileSystem.listDirectory(repo.resolve("logs"), null, false)).hasSize(3);
        }

        @Test
        @DisplayName("Listing should leave out links that escape the sandbox")
        void listDirectory_shouldHideEscapingLinks() throws Exception {
            Files.createSymbolicLink(repo.resolve("logs/evil.log"), outside.resolve("secret.log"));

            assertThat(fileSystem.listDirectory(repo.resolve("logs"), "*.log", true))
                    .extracting(path -> path.getFileName().toString())
                    .containsExactly("app.log");
        }

        @Test
        @DisplayName("Listing a file should fail")
        void listDirectory_onFile_shouldFail() {
            assertThatThrownBy(() -> fileSystem.listDirectory(repo.resolve("logs/app.log"), null, false))
                    .isInstanceOf(NotDirectoryException.class);
        }

        @Test
        @DisplayName("Search should walk subdirectories of every readable root")
        void searchFiles_shouldWalkRoots() throws Exception {
            List<Path> found = fileSystem.searchFiles("*.log", List.of(), 0);

            assertThat(found).extracting(path -> path.getFileName().toString())
                    .containsExactlyInAnyOrder("app.log", "db.log");
        }

        @Test
        @DisplayName("Search with a slash should match relative paths")
        void searchFiles_relativeGlob_shouldMatchPaths() throws Exception {
            List<Path> found = fileSystem.searchFiles("logs/nested/*.log", List.of(repo), 10);

            assertThat(found).extracting(path -> path.getFileName().toString()).containsExactly("db.log");
        }

        @Test
        @DisplayName("Search should cap results")
        void searchFiles_shouldCapResults() throws Exception {
            assertThat(fileSystem.searchFiles("*", List.of(repo), 1)).hasSize(1);
        }

        @Test
        @DisplayName("Search outside the sandbox should throw a violation")
        void searchFiles_outside_shouldThrow() {
            assertThatThrownBy(() -> fileSystem.searchFiles("*.log", List.of(outside), 0))
                    .isInstanceOf(SandboxViolationException.class);
        }
    }

    // ================================================================================
    // SEARCH ROOT TESTS
    // ================================================================================

    @Nested
    @DisplayName("Search Root Tests")
    class SearchRootTests {

        private SandboxedFileSystem logsOnly;

        @BeforeEach
        void setUp() {
            logsOnly = new SandboxedFileSystem(new CapabilitySandbox(new CapabilityGrant(
                    List.of(repo), List.of(parsers), List.of(repo.resolve("logs"), outside), Map.of())));
        }

        @Test
        @DisplayName("Search should walk the search roots, not the readable roots")
        void searchFiles_shouldUseSearchRoots() throws Exception {
            Files.writeString(repo.resolve("top.log"), "t\n");

            assertThat(logsOnly.searchFiles("*.log", List.of(), 0))
                    .extracting(path -> path.getFileName().toString())
                    .containsExactlyInAnyOrder("app.log", "db.log", "secret.log");
        }

        @Test
        @DisplayName("Search of a readable directory outside the search roots should be denied")
        void searchFiles_readableButNotSearchable_shouldThrow() {
            assertThatThrownBy(() -> logsOnly.searchFiles("*.log", List.of(repo), 0))
                    .isInstanceOf(SandboxViolationException.class);
        }

        @Test
        @DisplayName("Similar file search should tolerate typos and rank by similarity")
        void findSimilarFiles_shouldRankBySimilarity() throws Exception {
            List<SimilarFile> similar = fileSystem.findSimilarFiles("app.lgo", List.of(),
                    SandboxedFileSystem.DEFAULT_SIMILARITY_THRESHOLD, 0);

            assertThat(similar).isNotEmpty();
            assertThat(similar.get(0).path().getFileName().toString()).isEqualTo("app.log");
            assertThat(similar).extracting(SimilarFile::score).isSortedAccordingTo((a, b) -> Double.compare(b, a));
            assertThat(similar).allSatisfy(match -> assertThat(match.score()).isBetween(70.0, 100.0));
        }

        @Test
        @DisplayName("Similar file search should match names without their extension")
        void findSimilarFiles_shouldIgnoreExtension() throws Exception {
            List<SimilarFile> similar = fileSystem.findSimilarFiles("NOTES", List.of(repo.resolve("logs")), 90, 5);

            assertThat(similar).extracting(match -> match.path().getFileName().toString())
                    .containsExactly("notes.txt");
            assertThat(similar.get(0).score()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Similar file search should respect the search roots")
        void findSimilarFiles_shouldRespectSearchRoots() throws Exception {
            assertThat(fileSystem.findSimilarFiles("secret.log", List.of(), 0, 0))
                    .extracting(match -> match.path().getFileName().toString())
                    .doesNotContain("secret.log");
            assertThatThrownBy(() -> fileSystem.findSimilarFiles("secret", List.of(outside), 70, 10))
                    .isInstanceOf(SandboxViolationException.class);
        }

        @Test
        @DisplayName("Similar file search should reject a threshold outside 0 to 100")
        void findSimilarFiles_invalidThreshold_shouldThrow() {
            assertThatThrownBy(() -> fileSystem.findSimilarFiles("app", List.of(), 101, 10))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
