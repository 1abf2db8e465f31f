package ai.porting.lst.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.dircache.DirCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands input files and directories into the source files to build.
 */
public class SourceFileLocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceFileLocator.class);
    private static final String GIT_DIRECTORY = ".git";

    /**
     * @param root repository root; identifiers are relative to it
     * @param inputs files or directories, relative ones resolved against {@code root}
     * @param extensions accepted extensions without the dot, lower case
     * @param trackedOnly keep only files present in the Git index of {@code root}
     * @return files sorted by identifier, without duplicates
     */
    public List<SourceFile> locate(Path root, List<Path> inputs, Set<String> extensions, boolean trackedOnly) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(inputs, "inputs");
        Objects.requireNonNull(extensions, "extensions");
        Path normalizedRoot = root.toAbsolutePath().normalize();

        Map<String, SourceFile> found = new LinkedHashMap<>();
        for (Path input : inputs) {
            Path resolved = normalizedRoot.resolve(input).normalize();
            for (Path path : expand(resolved)) {
                if (!extensions.contains(extensionOf(path))) {
                    continue;
                }
                String identifier = identifierOf(normalizedRoot, path);
                found.putIfAbsent(identifier, new SourceFile(path, identifier));
            }
        }

        List<SourceFile> files = new ArrayList<>(found.values());
        if (trackedOnly) {
            Optional<Set<String>> tracked = trackedPaths(normalizedRoot);
            if (tracked.isPresent()) {
                Set<String> trackedSet = tracked.get();
                files = files.stream()
                        .filter(file -> trackedSet.contains(file.identifier()))
                        .collect(Collectors.toList());
            } else {
                LOGGER.warn("Ignoring --tracked-only because {} is not a Git repository", normalizedRoot);
            }
        }
        files.sort(Comparator.comparing(SourceFile::identifier));
        return files;
    }

    static String identifierOf(Path root, Path path) {
        Path relative = path.startsWith(root) ? root.relativize(path) : path;
        return relative.toString().replace('\\', '/');
    }

    private List<Path> expand(Path input) {
        if (Files.isRegularFile(input)) {
            return List.of(input);
        }
        if (!Files.isDirectory(input)) {
            throw new SourceDiscoveryException("Input does not exist: " + input);
        }
        try (Stream<Path> walk = Files.walk(input)) {
            return walk
                    .filter(path -> !isInsideGitDirectory(input, path))
                    .filter(Files::isRegularFile)
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new SourceDiscoveryException("Failed to walk " + input, ex);
        }
    }

    private boolean isInsideGitDirectory(Path base, Path path) {
        for (Path part : base.relativize(path)) {
            if (GIT_DIRECTORY.equals(part.toString())) {
                return true;
            }
        }
        return false;
    }

    private Optional<Set<String>> trackedPaths(Path root) {
        if (!Files.isDirectory(root.resolve(GIT_DIRECTORY))) {
            return Optional.empty();
        }
        try (Git git = Git.open(root.toFile())) {
            DirCache index = git.getRepository().readDirCache();
            Set<String> paths = new HashSet<>();
            for (int i = 0; i < index.getEntryCount(); i++) {
                paths.add(index.getEntry(i).getPathString());
            }
            LOGGER.debug("Git index of {} lists {} tracked files", root, paths.size());
            return Optional.of(paths);
        } catch (IOException ex) {
            throw new SourceDiscoveryException("Failed to read the Git index of " + root, ex);
        }
    }

    private static String extensionOf(Path path) {
        String name = path.getFileName().toString();
        int idx = name.lastIndexOf('.') + 1;
        if (idx <= 0 || idx == name.length()) {
            return "";
        }
        return name.substring(idx).toLowerCase(Locale.ROOT);
    }
}
