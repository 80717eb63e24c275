package com.example.jozin;

import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled set of glob patterns. A path matches when any pattern matches it.
 *
 * <p>Globs follow {@link FileSystem#getPathMatcher(String)} syntax: {@code *} stays within one
 * path segment, {@code **} crosses separators, {@code ?} matches one character and
 * {@code [...]} is a character class. Patterns are validated once, in {@link #compile(List)}.
 */
public final class PatternMatcher {
    private final List<PathMatcher> matchers;

    private PatternMatcher(List<PathMatcher> matchers) {
        this.matchers = matchers;
    }

    public static PatternMatcher compile(List<String> patterns) throws ScanException {
        FileSystem fs = FileSystems.getDefault();
        List<PathMatcher> compiled = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                throw ScanException.validation("Glob pattern must not be blank");
            }
            try {
                compiled.add(fs.getPathMatcher("glob:" + pattern.trim()));
            } catch (PatternSyntaxException ex) {
                throw ScanException.validation("Invalid glob pattern '" + pattern + "': " + ex.getDescription(), ex);
            }
        }
        return new PatternMatcher(List.copyOf(compiled));
    }

    public boolean matches(Path path) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(path)) {
                return true;
            }
        }
        return false;
    }
}
