package ai.codesniff.lint.runner;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands the paths given on the command line into the files to check.
 *
 * <p>Files named explicitly are always checked; directories are walked recursively and only contribute files
 * with one of the configured extensions. Hidden directories are skipped.
 */
public class FileCollector {

    private final Set<String> extensions;

    public FileCollector(Set<String> extensions) {
        this.extensions = Set.copyOf(Objects.requireNonNull(extensions, "extensions"));
    }

    public List<Path> collect(List<Path> paths) {
        Set<Path> files = new LinkedHashSet<>();
        for (Path path : paths) {
            if (Files.isRegularFile(path)) {
                files.add(path.normalize());
            } else if (Files.isDirectory(path)) {
                files.addAll(walk(path));
            } else {
                throw new IllegalArgumentException("Path does not exist: " + path);
            }
        }
        return new ArrayList<>(files);
    }

    private List<Path> walk(Path directory) {
        try (Stream<Path> stream = Files.walk(directory)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(file -> !isHidden(directory, file))
                    .filter(this::hasCheckedExtension)
                    .map(Path::normalize)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list files under " + directory, ex);
        }
    }

    boolean hasCheckedExtension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        return extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static boolean isHidden(Path root, Path file) {
        for (Path part : root.relativize(file)) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
