package com.multila.backend.modules.export.infrastructure;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.multila.backend.global.error.ProblemException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * The export directory. Files are generated under a {@code .part} name and published by an atomic
 * rename, so a visible {@code .csv} is always complete.
 */
@Component
public class ExportStorage {

    private static final Logger log = LoggerFactory.getLogger(ExportStorage.class);

    private static final Pattern SAFE_FILENAME = Pattern.compile("^[\\w-]+\\.csv$");
    private static final String PART_SUFFIX = ".part";

    private final Path directory;

    public ExportStorage(@Value("${multila.export.directory:./data/exports}") String directory) {
        this.directory = Paths.get(directory).toAbsolutePath().normalize();
    }

    public static boolean isSafeFilename(String filename) {
        return filename != null && SAFE_FILENAME.matcher(filename).matches();
    }

    /**
     * @throws ProblemException 403 {@code INVALID_EXPORT_FILENAME} for names outside {@code [\w-]+.csv}
     */
    public Path resolve(String filename) {
        if (!isSafeFilename(filename)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "INVALID_EXPORT_FILENAME",
                    "export file names must match [A-Za-z0-9_-]+.csv");
        }
        Path resolved = directory.resolve(filename).normalize();
        if (!resolved.getParent().equals(directory)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "INVALID_EXPORT_FILENAME");
        }
        return resolved;
    }

    public Path partFileFor(String filename) {
        return resolve(filename).resolveSibling(filename + PART_SUFFIX);
    }

    public void ensureDirectory() throws IOException {
        Files.createDirectories(directory);
    }

    public void publish(Path partFile, Path target) throws IOException {
        try {
            Files.move(partFile, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(partFile, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public boolean delete(String filename) {
        try {
            return Files.deleteIfExists(resolve(filename));
        } catch (IOException ex) {
            throw new UncheckedIOException("could not delete export file " + filename, ex);
        }
    }

    public void deletePartFile(Path partFile) {
        try {
            Files.deleteIfExists(partFile);
        } catch (IOException ex) {
            log.warn("Could not remove temporary export file {}", partFile, ex);
        }
    }

    /**
     * Published export files, newest name first.
     */
    public List<String> listFilenames() {
        List<String> names = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return names;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.csv")) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                if (isSafeFilename(name) && Files.isRegularFile(path)) {
                    names.add(name);
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("could not list export directory " + directory, ex);
        }
        names.sort((a, b) -> b.compareTo(a));
        return names;
    }

    /**
     * Removes published files last modified before {@code cutoff}.
     *
     * @return number of removed files
     */
    public int deleteOlderThan(Instant cutoff) {
        int removed = 0;
        for (String name : listFilenames()) {
            Path path = directory.resolve(name);
            try {
                if (Files.getLastModifiedTime(path).toInstant().isBefore(cutoff) && Files.deleteIfExists(path)) {
                    removed++;
                }
            } catch (IOException ex) {
                log.warn("Could not remove expired export file {}", name, ex);
            }
        }
        return removed;
    }

    /**
     * Removes {@code .part} files that no running task is writing, e.g. after a crash.
     */
    public int deleteOrphanedPartFiles(Set<String> inFlightFilenames) {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + PART_SUFFIX)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                String target = name.substring(0, name.length() - PART_SUFFIX.length());
                if (!inFlightFilenames.contains(target)) {
                    Files.deleteIfExists(path);
                    removed++;
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("could not clean export directory " + directory, ex);
        }
        return removed;
    }
}
