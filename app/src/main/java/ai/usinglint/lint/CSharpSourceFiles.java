package ai.usinglint.lint;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Expands command line paths into the C# files to lint. */
public final class CSharpSourceFiles {
    private static final Logger logger = LogManager.getLogger(CSharpSourceFiles.class);

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("bin", "obj", ".git", ".vs");

    private CSharpSourceFiles() {}

    /**
     * Collects {@code *.cs} files. Directories are walked recursively, skipping build output and VCS directories;
     * excludes are matched against the path relative to the directory being walked. Explicit file arguments are
     * always kept. Results are sorted per argument and free of duplicates.
     *
     * @throws IOException if a path does not exist or a directory cannot be walked
     */
    public static List<Path> collect(List<Path> paths, UsingLintConfig config) throws IOException {
        var result = new LinkedHashSet<Path>();
        for (var path : paths) {
            var normalized = path.normalize();
            if (Files.isDirectory(normalized)) {
                result.addAll(walk(normalized, config));
            } else if (Files.isRegularFile(normalized)) {
                result.add(normalized);
            } else {
                throw new IOException("No such file or directory: " + path);
            }
        }
        return new ArrayList<>(result);
    }

    private static List<Path> walk(Path root, UsingLintConfig config) throws IOException {
        var found = new ArrayList<Path>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root)) {
                    var name = dir.getFileName().toString().toLowerCase(Locale.ROOT);
                    if (SKIPPED_DIRECTORIES.contains(name)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (isCSharpFile(file)) {
                    if (config.isExcluded(root.relativize(file))) {
                        logger.debug("Excluded {}", file);
                    } else {
                        found.add(file);
                    }
                }
                return FileVisitResult.CONTINUE;
            }
        });
        found.sort(null);
        return found;
    }

    static boolean isCSharpFile(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".cs");
    }
}
