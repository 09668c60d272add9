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
package com.logschema.agent.sandbox.tools;

import com.logschema.agent.observability.policy.LoggingStrategy;
import com.logschema.agent.observability.tool.ToolCatalog;
import com.logschema.agent.observability.tool.ToolDescriptor;
import com.logschema.agent.sandbox.exec.CommandResult;
import com.logschema.agent.sandbox.exec.SafeCommandRunner;
import com.logschema.agent.sandbox.fs.SandboxedFileSystem;
import com.logschema.agent.sandbox.fs.SimilarFile;
import com.logschema.agent.sandbox.jsonl.JsonlHandleRegistry;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.logschema.agent.observability.tool.ToolArguments.optionalBoolean;
import static com.logschema.agent.observability.tool.ToolArguments.optionalDouble;
import static com.logschema.agent.observability.tool.ToolArguments.optionalInt;
import static com.logschema.agent.observability.tool.ToolArguments.optionalString;
import static com.logschema.agent.observability.tool.ToolArguments.optionalStringList;
import static com.logschema.agent.observability.tool.ToolArguments.requireString;

/**
 * The sandboxed file, command and JSONL operations, exposed as agent tools.
 */
public class SandboxTools implements ToolCatalog {

    public static final String READ_FILE_CONTENT = "read_file_content";
    public static final String WRITE_FILE_CONTENT = "write_file_content";
    public static final String LIST_DIRECTORY_CONTENTS = "list_directory_contents";
    public static final String SEARCH_FILES = "search_files";
    public static final String FIND_SIMILAR_FILES = "find_similar_files";
    public static final String LINE_COUNT = "line_count";
    public static final String RUN_SAFE_COMMAND = "run_safe_command";
    public static final String OPEN_AND_REGISTER_JSONL = "open_and_register_jsonl";
    public static final String READ_JSONL = "read_jsonl";
    public static final String CLOSE_JSONL = "close_jsonl";

    /** Lines returned by {@code read_jsonl} when the agent gives no count. */
    public static final int DEFAULT_JSONL_BATCH = 10;

    private final SandboxedFileSystem fileSystem;
    private final SafeCommandRunner commandRunner;
    private final JsonlHandleRegistry handles;

    public SandboxTools(SandboxedFileSystem fileSystem, SafeCommandRunner commandRunner, JsonlHandleRegistry handles) {
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
        this.commandRunner = Objects.requireNonNull(commandRunner, "commandRunner");
        this.handles = Objects.requireNonNull(handles, "handles");
    }

    @Override
    public List<ToolDescriptor> tools() {
        return List.of(
                new ToolDescriptor(READ_FILE_CONTENT, LoggingStrategy.TRUNCATE,
                        "Read a text file, optionally only its first max_lines lines",
                        args -> fileSystem.readFile(path(args, "path"), optionalInt(args, "max_lines", 0))),
                new ToolDescriptor(WRITE_FILE_CONTENT, LoggingStrategy.METADATA_ONLY,
                        "Write a text file under a writable directory",
                        args -> {
                            String content = requireString(args, "content");
                            Path written = fileSystem.writeFile(path(args, "path"), content,
                                    optionalBoolean(args, "overwrite", false));
                            return "Wrote " + content.length() + " characters to " + written;
                        }),
                new ToolDescriptor(LIST_DIRECTORY_CONTENTS, LoggingStrategy.FULL,
                        "List a directory, optionally filtered by a glob pattern",
                        args -> fileSystem.listDirectory(path(args, "path"), optionalString(args, "pattern", "*"),
                                        optionalBoolean(args, "files_only", false))
                                .stream().map(Path::toString).toList()),
                new ToolDescriptor(SEARCH_FILES, LoggingStrategy.FULL,
                        "Find files matching a glob pattern under the given directories",
                        args -> fileSystem.searchFiles(requireString(args, "pattern"),
                                        directories(args),
                                        optionalInt(args, "max_results", SandboxedFileSystem.DEFAULT_MAX_RESULTS))
                                .stream().map(Path::toString).toList()),
                new ToolDescriptor(FIND_SIMILAR_FILES, LoggingStrategy.FULL,
                        "Find files whose names resemble a possibly misspelled file name",
                        args -> fileSystem.findSimilarFiles(requireString(args, "filename"),
                                        directories(args),
                                        optionalDouble(args, "threshold", SandboxedFileSystem.DEFAULT_SIMILARITY_THRESHOLD),
                                        optionalInt(args, "max_results", SandboxedFileSystem.DEFAULT_SIMILAR_RESULTS))
                                .stream().map(SandboxTools::similarFile).toList()),
                new ToolDescriptor(LINE_COUNT, LoggingStrategy.FULL,
                        "Count the lines of a text file",
                        args -> fileSystem.lineCount(path(args, "path"))),
                new ToolDescriptor(RUN_SAFE_COMMAND, LoggingStrategy.FULL,
                        "Run a granted command such as a test runner or linter",
                        args -> {
                            int timeoutSeconds = optionalInt(args, "timeout_seconds", 0);
                            String workingDirectory = optionalString(args, "working_directory", null);
                            CommandResult result = commandRunner.run(requireString(args, "command"),
                                    optionalStringList(args, "args"),
                                    timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null,
                                    workingDirectory == null ? null : Path.of(workingDirectory));
                            Map<String, Object> output = new LinkedHashMap<>();
                            output.put("exit_code", result.exitCode());
                            output.put("stdout", result.stdout());
                            output.put("stderr", result.stderr());
                            return output;
                        }),
                new ToolDescriptor(OPEN_AND_REGISTER_JSONL, LoggingStrategy.FULL,
                        "Open a JSONL file for incremental reading and return its handle id",
                        args -> handles.open(path(args, "path"))),
                new ToolDescriptor(READ_JSONL, LoggingStrategy.TRUNCATE,
                        "Read the next n lines of an open JSONL handle",
                        args -> handles.readLines(requireString(args, "handle_id"),
                                optionalInt(args, "n", DEFAULT_JSONL_BATCH))),
                new ToolDescriptor(CLOSE_JSONL, LoggingStrategy.FULL,
                        "Close an open JSONL handle",
                        args -> {
                            String handleId = requireString(args, "handle_id");
                            long linesRead = handles.close(handleId);
                            Map<String, Object> output = new LinkedHashMap<>();
                            output.put("handle_id", handleId);
                            output.put("lines_read", linesRead);
                            return output;
                        })
        );
    }

    private static List<Path> directories(Map<String, Object> args) {
        return optionalStringList(args, "directories").stream().map(Path::of).toList();
    }

    private static Map<String, Object> similarFile(SimilarFile match) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("path", match.path().toString());
        output.put("similarity_score", match.score());
        return output;
    }

    private static Path path(Map<String, Object> args, String name) {
        return Path.of(requireString(args, name));
    }
}
