package com.example.fssnapshot.scan;

import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Lazy breadth-first walk yielding the regular files below a root, one directory listing at a time.
 * Entries of a directory are visited in name order. Directories that cannot be listed are reported
 * to the failure sink and skipped.
 */
final class DirectoryWalker implements Iterator<Path> {
    private final Path root;
    private final Predicate<String> descendInto;
    private final boolean followLinks;
    private final Consumer<ScanFailure> failures;
    private final Logger logger;
    private final Deque<Path> pendingDirectories = new ArrayDeque<>();
    private final Deque<Path> pendingFiles = new ArrayDeque<>();
    private final Set<Path> visited = new HashSet<>();

    DirectoryWalker(Path root,
                    Predicate<String> descendInto,
                    boolean followLinks,
                    Consumer<ScanFailure> failures,
                    Logger logger) {
        this.root = root;
        this.descendInto = descendInto;
        this.followLinks = followLinks;
        this.failures = failures;
        this.logger = logger;
        pendingDirectories.addLast(root);
    }

    @Override
    public boolean hasNext() {
        while (pendingFiles.isEmpty() && !pendingDirectories.isEmpty()) {
            list(pendingDirectories.removeFirst());
        }
        return !pendingFiles.isEmpty();
    }

    @Override
    public Path next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return pendingFiles.removeFirst();
    }

    /**
     * Root-relative, {@code /}-separated form of a path below the root.
     */
    static String relativize(Path root, Path path) {
        Path relative = root.relativize(path);
        List<String> names = new ArrayList<>(relative.getNameCount());
        for (Path name : relative) {
            names.add(name.toString());
        }
        return String.join("/", names);
    }

    private void list(Path directory) {
        if (followLinks && !markVisited(directory)) {
            return;
        }
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        } catch (IOException ex) {
            logger.debug("Failed to list directory {}", directory, ex);
            failures.accept(ScanFailure.single(directory.toString(), true, Instant.now(), ex.toString()));
            return;
        }
        entries.sort(null);

        for (Path entry : entries) {
            BasicFileAttributes attrs;
            try {
                attrs = followLinks
                        ? Files.readAttributes(entry, BasicFileAttributes.class)
                        : Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            } catch (IOException ex) {
                // Dangling links end up here when links are followed.
                logger.debug("Failed to read attributes for {}", entry, ex);
                failures.accept(ScanFailure.single(entry.toString(), false, Instant.now(), ex.toString()));
                continue;
            }
            if (attrs.isDirectory()) {
                if (descendInto.test(relativize(root, entry))) {
                    pendingDirectories.addLast(entry);
                }
            } else if (attrs.isRegularFile()) {
                pendingFiles.addLast(entry);
            } else {
                logger.debug("Skipping {} (not a regular file)", entry);
            }
        }
    }

    private boolean markVisited(Path directory) {
        try {
            return visited.add(directory.toRealPath());
        } catch (IOException ex) {
            logger.warn("Failed to resolve {}", directory, ex);
            return false;
        }
    }
}
