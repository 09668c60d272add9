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

import com.logschema.agent.sandbox.CapabilitySandbox;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * File operations available to agent-generated code. Every operation is authorized by
 * the {@link CapabilitySandbox} before it touches the filesystem.
 */
public class SandboxedFileSystem {

    private static final Logger log = LoggerFactory.getLogger(SandboxedFileSystem.class);

    /** Result cap of {@link #searchFiles} when the caller gives none. */
    public static final int DEFAULT_MAX_RESULTS = 100;

    /** Result cap of {@link #findSimilarFiles} when the caller gives none. */
    public static final int DEFAULT_SIMILAR_RESULTS = 10;

    /** Minimum similarity of {@link #findSimilarFiles} when the caller gives none. */
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 70.0;

    private static final JaroWinklerSimilarity SIMILARITY = new JaroWinklerSimilarity();

    private final CapabilitySandbox sandbox;

    public SandboxedFileSystem(CapabilitySandbox sandbox) {
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox");
    }

    /**
     * Reads a text file.
     *
     * @param path     the file
     * @param maxLines maximum number of lines returned, 0 or less for all
     * @return the content, lines joined with {@code \n}
     */
    public String readFile(Path path, int maxLines) throws IOException {
        Path real = sandbox.authorizeRead(path);
        if (!Files.isRegularFile(real)) {
            throw new IOException("Not a regular file: " + path);
        }
        if (maxLines <= 0) {
            return Files.readString(real, StandardCharsets.UTF_8);
        }
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(real, StandardCharsets.UTF_8)) {
            String line;
            while (lines.size() < maxLines && (line = reader.readLine()) != null) {
                lines.add(line);
            }
        }
        return String.join("\n", lines);
    }

    /**
     * Writes a text file.
     *
     * @param path      the file
     * @param content   new content
     * @param overwrite replace an existing file
     * @return the real path written
     * @throws FileAlreadyExistsException if the file exists and {@code overwrite} is false
     */
    public Path writeFile(Path path, String content, boolean overwrite) throws IOException {
        Path real = sandbox.authorizeWrite(path);
        if (Files.exists(real) && !overwrite) {
            throw new FileAlreadyExistsException(path.toString(), null, "use overwrite to replace it");
        }
        if (overwrite) {
            replace(real, content == null ? "" : content);
        } else {
            Files.writeString(real, content == null ? "" : content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        }
        log.debug("Wrote {} chars to {}", content == null ? 0 : content.length(), real);
        return real;
    }

    /**
     * Replaces a file by writing a sibling temporary file and renaming it over the
     * target. The rename replaces whatever entry is at {@code real}, a symbolic link
     * included, and never writes through it.
     *
     * @param real    authorized real path of the target
     * @param content new content
     */
    static void replace(Path real, String content) throws IOException {
        Path parent = real.getParent();
        if (parent == null) {
            throw new IOException("No parent directory: " + real);
        }
        Path temp = Files.createTempFile(parent, "." + real.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING);
            try {
                Files.move(temp, real, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, real, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    /**
     * Lists a directory's entries, sorted by name. Entries that resolve outside the
     * readable roots are left out.
     *
     * @param directory the directory
     * @param glob      glob on entry names, null for all
     * @param filesOnly leave out directories
     * @return the entries
     */
    public List<Path> listDirectory(Path directory, String glob, boolean filesOnly) throws IOException {
        Path real = sandbox.authorizeRead(directory);
        if (!Files.isDirectory(real)) {
            throw new NotDirectoryException(directory.toString());
        }
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(real, glob == null || glob.isBlank() ? "*" : glob)) {
            for (Path entry : stream) {
                if (filesOnly && Files.isDirectory(entry)) {
                    continue;
                }
                if (sandbox.checkRead(entry).allowed()) {
                    entries.add(entry);
                }
            }
        }
        entries.sort(null);
        return entries;
    }

    /**
     * Finds files matching a glob under the given directories, without following
     * directory links. A glob without {@code /} is matched against file names, otherwise
     * against the path relative to the searched directory.
     *
     * @param glob        the glob
     * @param directories directories to search, each under a search root, empty for every search root
     * @param maxResults  result cap, 0 or less for {@link #DEFAULT_MAX_RESULTS}
     * @return matching files, sorted
     */
    public List<Path> searchFiles(String glob, List<Path> directories, int maxResults) throws IOException {
        if (glob == null || glob.isBlank()) {
            throw new IllegalArgumentException("Search pattern must not be blank");
        }
        int limit = maxResults <= 0 ? DEFAULT_MAX_RESULTS : maxResults;
        boolean matchRelative = glob.indexOf('/') >= 0;
        List<Path> matches = new ArrayList<>();
        for (Path root : searchRoots(directories)) {
            PathMatcher matcher = root.getFileSystem().getPathMatcher("glob:" + glob);
            walkFiles(root, file -> matcher.matches(matchRelative ? root.relativize(file) : file.getFileName()),
                    matches);
        }
        List<Path> sorted = matches.stream().distinct().sorted().limit(limit).toList();
        if (matches.size() > limit) {
            log.debug("Search for '{}' capped at {} of {} matches", glob, limit, matches.size());
        }
        return sorted;
    }

    /**
     * Finds files whose names resemble the given name, for names that are misspelled or
     * only partly known. Names are compared case-insensitively by Jaro-Winkler
     * similarity, with and without their extension.
     *
     * @param fileName    the name to look for
     * @param directories directories to search, each under a search root, empty for every search root
     * @param threshold   minimum similarity, 0 to 100
     * @param maxResults  result cap, 0 or less for {@link #DEFAULT_SIMILAR_RESULTS}
     * @return the matches, most similar first
     */
    public List<SimilarFile> findSimilarFiles(String fileName, List<Path> directories, double threshold,
                                              int maxResults) throws IOException {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("File name must not be blank");
        }
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("Threshold must be between 0 and 100 but was " + threshold);
        }
        int limit = maxResults <= 0 ? DEFAULT_SIMILAR_RESULTS : maxResults;
        String query = fileName.trim().toLowerCase(Locale.ROOT);
        List<Path> files = new ArrayList<>();
        for (Path root : searchRoots(directories)) {
            walkFiles(root, file -> true, files);
        }
        List<SimilarFile> similar = files.stream()
                .distinct()
                .map(file -> new SimilarFile(file, similarity(query, file.getFileName().toString())))
                .filter(match -> match.score() >= threshold)
                .sorted(Comparator.comparingDouble(SimilarFile::score).reversed()
                        .thenComparing(SimilarFile::path))
                .limit(limit)
                .toList();
        log.debug("Found {} files similar to '{}' (threshold {})", similar.size(), fileName, threshold);
        return similar;
    }

    private static double similarity(String query, String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        double score = SIMILARITY.apply(query, lower);
        int dot = lower.lastIndexOf('.');
        if (dot > 0) {
            score = Math.max(score, SIMILARITY.apply(query, lower.substring(0, dot)));
        }
        return Math.round(score * 1000) / 10.0;
    }

    private List<Path> searchRoots(List<Path> directories) {
        if (directories != null && !directories.isEmpty()) {
            return directories.stream().map(sandbox::authorizeSearch).toList();
        }
        List<Path> roots = new ArrayList<>();
        for (Path root : sandbox.getGrant().effectiveSearchRoots()) {
            if (sandbox.checkSearch(root).allowed()) {
                roots.add(sandbox.authorizeSearch(root));
            } else {
                log.debug("Skipping search root {} that is not an existing directory", root);
            }
        }
        return roots;
    }

    private void walkFiles(Path root, Predicate<Path> filter, List<Path> found) throws IOException {
        try (Stream<Path> files = Files.walk(root)) {
            files.filter(Files::isRegularFile)
                    .filter(filter)
                    .filter(sandbox::isSearchable)
                    .forEach(found::add);
        }
    }

    /**
     * @param path the file
     * @return number of lines in the file
     */
    public long lineCount(Path path) throws IOException {
        Path real = sandbox.authorizeRead(path);
        try (Stream<String> lines = Files.lines(real, StandardCharsets.UTF_8)) {
            return lines.count();
        }
    }
}
