package com.example.fssnapshot.scan;

import com.example.fssnapshot.model.FileRecord;
import com.example.fssnapshot.pattern.PathTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks a root directory and turns every regular file into a {@link FileRecord}.
 * <p>
 * Categories of path templates are tried in insertion order and templates within a category in
 * list order; the first template that accepts a path decides its metadata. Files no template
 * accepts are still recorded, with empty metadata.
 * <p>
 * The work can be split into one partition per category plus one for unmatched files. Every file
 * belongs to exactly one partition, so concatenating all partitions yields the same records as
 * {@link #scan()}. Each returned stream performs a fresh walk and can be consumed once.
 * <p>
 * Directories and entries the walk cannot read are recorded only by walks over the whole tree
 * ({@link #scan()} and {@link #scanUnmatched()}), so a partitioned import reports each of them once.
 */
public final class Scanner {
    private final Path root;
    private final Map<String, List<PathTemplate>> categories;
    private final FileRecordExtractor extractor;
    private final boolean followLinks;
    private final int fileRetryAttempts;
    private final Logger logger;
    private final ConcurrentLinkedQueue<ScanFailure> failures = new ConcurrentLinkedQueue<>();

    public Scanner(Path root,
                   Map<String, List<PathTemplate>> categories,
                   FileRecordExtractor extractor,
                   boolean followLinks,
                   int fileRetryAttempts) {
        this(root, categories, extractor, followLinks, fileRetryAttempts, LoggerFactory.getLogger(Scanner.class));
    }

    public Scanner(Path root,
                   Map<String, List<PathTemplate>> categories,
                   FileRecordExtractor extractor,
                   boolean followLinks,
                   int fileRetryAttempts,
                   Logger logger) {
        this.root = root.toAbsolutePath().normalize();
        this.categories = new LinkedHashMap<>(categories);
        this.extractor = extractor;
        this.followLinks = followLinks;
        this.fileRetryAttempts = Math.max(1, fileRetryAttempts);
        this.logger = logger;
    }

    /**
     * Scans the whole tree, matched and unmatched files alike.
     */
    public Stream<FileRecord> scan() throws ScanIOException {
        checkRoot();
        ScanStatistics stats = new ScanStatistics();
        return stream(walk(directory -> true, true), stats, "all")
                .map(file -> {
                    String relative = DirectoryWalker.relativize(root, file);
                    return match(relative)
                            .map(match -> extract(file, relative, match.metadata(), stats))
                            .orElseGet(() -> extractUnmatched(file, relative, stats));
                })
                .flatMap(Optional::stream);
    }

    /**
     * Scans only the files whose first accepting category is {@code category}.
     */
    public Stream<FileRecord> scanCategory(String category) throws ScanIOException {
        List<PathTemplate> templates = categories.get(category);
        if (templates == null) {
            throw new IllegalArgumentException("Unknown category: " + category);
        }
        checkRoot();
        ScanStatistics stats = new ScanStatistics();
        Predicate<String> descendInto = directory -> templates.stream()
                .anyMatch(template -> template.glob().mayContain(directory));
        return stream(walk(descendInto, false), stats, category)
                .map(file -> {
                    String relative = DirectoryWalker.relativize(root, file);
                    return match(relative)
                            .filter(match -> match.category().equals(category))
                            .flatMap(match -> extract(file, relative, match.metadata(), stats));
                })
                .flatMap(Optional::stream);
    }

    /**
     * Scans only the files that no category accepts.
     */
    public Stream<FileRecord> scanUnmatched() throws ScanIOException {
        checkRoot();
        ScanStatistics stats = new ScanStatistics();
        return stream(walk(directory -> true, true), stats, "unmatched")
                .map(file -> {
                    String relative = DirectoryWalker.relativize(root, file);
                    return match(relative).isPresent()
                            ? Optional.<FileRecord>empty()
                            : extractUnmatched(file, relative, stats);
                })
                .flatMap(Optional::stream);
    }

    /**
     * Finds the winning category and captured metadata for a root-relative path.
     */
    public Optional<TemplateMatch> match(String relativePath) {
        for (Map.Entry<String, List<PathTemplate>> category : categories.entrySet()) {
            for (PathTemplate template : category.getValue()) {
                if (!template.glob().matches(relativePath)) {
                    continue;
                }
                Optional<Map<String, String>> metadata = template.matcher().match(relativePath);
                if (metadata.isPresent()) {
                    return Optional.of(new TemplateMatch(category.getKey(), template, metadata.get()));
                }
            }
        }
        return Optional.empty();
    }

    public List<String> categories() {
        return List.copyOf(categories.keySet());
    }

    public Path root() {
        return root;
    }

    /**
     * Files and directories skipped so far by any scan of this instance.
     */
    public List<ScanFailure> failures() {
        return List.copyOf(failures);
    }

    /**
     * Fails if the root is missing or cannot be listed.
     */
    public void checkRoot() throws ScanIOException {
        if (!Files.isDirectory(root)) {
            throw new ScanIOException(root, "Scan root is not a directory");
        }
        try (DirectoryStream<Path> ignored = Files.newDirectoryStream(root)) {
            logger.debug("Scanning {}", root);
        } catch (IOException ex) {
            throw new ScanIOException(root, "Failed to list scan root", ex);
        }
    }

    private Iterator<Path> walk(Predicate<String> descendInto, boolean recordFailures) {
        Consumer<ScanFailure> sink = recordFailures
                ? this::recordWalkFailure
                : failure -> logger.debug("Partition walk skipped {}: {}", failure.path(), failure.lastError());
        return new DirectoryWalker(root, descendInto, followLinks, sink, logger);
    }

    private void recordWalkFailure(ScanFailure failure) {
        logger.warn("Skipping {}: {}", failure.path(), failure.lastError());
        failures.add(failure);
    }

    private Stream<Path> stream(Iterator<Path> files, ScanStatistics stats, String partition) {
        Iterator<Path> logging = new Iterator<>() {
            private boolean reported;

            @Override
            public boolean hasNext() {
                boolean more = files.hasNext();
                if (!more && !reported) {
                    reported = true;
                    logger.info("Scanned {} files ({} bytes, {} failures) in partition '{}' of {}",
                            stats.totalFiles(), stats.totalBytes(), stats.failures(), partition, root);
                }
                return more;
            }

            @Override
            public Path next() {
                return files.next();
            }
        };
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(logging, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    private Optional<FileRecord> extract(Path file, String relative, Map<String, String> metadata,
                                         ScanStatistics stats) {
        return withRetries(file, stats, () -> extractor.extract(file, relative, metadata));
    }

    private Optional<FileRecord> extractUnmatched(Path file, String relative, ScanStatistics stats) {
        return withRetries(file, stats, () -> extractor.extractUnmatched(file, relative));
    }

    private Optional<FileRecord> withRetries(Path file, ScanStatistics stats, Extraction extraction) {
        List<RetryAttempt> attempts = new ArrayList<>();
        for (int attempt = 1; attempt <= fileRetryAttempts; attempt++) {
            try {
                FileRecord record = extraction.run();
                stats.addFile(record.size());
                return Optional.of(record);
            } catch (IOException ex) {
                attempts.add(new RetryAttempt(attempt, Instant.now(), ex.toString()));
                logger.debug("Attempt {} of {} failed for {}", attempt, fileRetryAttempts, file, ex);
            }
        }
        RetryAttempt last = attempts.get(attempts.size() - 1);
        logger.warn("Skipping {} after {} attempts: {}", file, attempts.size(), last.error());
        failures.add(new ScanFailure(file.toString(), false, attempts.size(), fileRetryAttempts,
                last.timestamp(), last.error(), attempts));
        stats.addFailure();
        return Optional.empty();
    }

    @FunctionalInterface
    private interface Extraction {
        FileRecord run() throws IOException;
    }

    /**
     * The category and template that accepted a path, with the captured metadata.
     */
    public record TemplateMatch(String category, PathTemplate template, Map<String, String> metadata) {
    }
}
