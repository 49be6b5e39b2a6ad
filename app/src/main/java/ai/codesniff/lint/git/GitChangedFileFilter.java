package ai.codesniff.lint.git;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restricts a run to files that git reports as modified, changed, added or untracked.
 */
public class GitChangedFileFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(GitChangedFileFilter.class);

    /**
     * Absolute, normalized paths of the changed files in the repository containing {@code start}.
     */
    public Set<Path> changedFiles(Path start) {
        Objects.requireNonNull(start, "start");
        Path absolute = start.toAbsolutePath().normalize();
        FileRepositoryBuilder builder = new FileRepositoryBuilder().readEnvironment().findGitDir(absolute.toFile());
        if (builder.getGitDir() == null) {
            throw new GitStatusException(absolute + " is not inside a git repository");
        }
        try (Repository repository = builder.build(); Git git = new Git(repository)) {
            Path workTree = canonical(repository.getWorkTree().toPath());
            Status status = git.status().call();
            Set<Path> changed = Stream.of(status.getModified(), status.getChanged(), status.getAdded(),
                            status.getUntracked())
                    .flatMap(Set::stream)
                    .map(file -> canonical(workTree.resolve(file)))
                    .collect(Collectors.toCollection(TreeSet::new));
            LOGGER.debug("Git reports {} changed files under {}", changed.size(), workTree);
            return changed;
        } catch (GitAPIException | IOException ex) {
            throw new GitStatusException("Failed to read git status for " + absolute, ex);
        }
    }

    public List<Path> filter(List<Path> files, Path start) {
        Objects.requireNonNull(files, "files");
        Set<Path> changed = changedFiles(start);
        List<Path> kept = files.stream()
                .filter(file -> changed.contains(canonical(file)))
                .collect(Collectors.toList());
        LOGGER.info("Checking {} of {} files changed according to git", kept.size(), files.size());
        return kept;
    }

    private static Path canonical(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException ex) {
            return path.toAbsolutePath().normalize();
        }
    }
}
