package ca.jonathanfritz.bankcat.utils;

import java.io.File;
import java.nio.file.Path;

public class PathUtils {

    /**
     * Returns the full path to the ~/.bankcat directory, where config.yaml lives by default
     */
    public Path getConfigPath() {
        return Path.of(System.getProperty("user.home"), ".bankcat");
    }

    /**
     * Expands unix-style path notations, including:
     * <ul>
     *     <li>~/ for current user's home directory</li>
     * </ul>
     */
    public Path expand(String path) {
        // handle unix-style home directory notation (i.e. ~/Documents/statements)
        if (path.startsWith("~" + File.separatorChar)) {
            return Path.of(System.getProperty("user.home"), path.substring(2));
        }

        return Path.of(path);
    }

    /**
     * Resolves a possibly relative path against a base directory. Absolute paths are returned as-is.
     */
    public Path resolve(Path baseDirectory, String path) {
        final Path expanded = expand(path);
        if (expanded.isAbsolute()) {
            return expanded;
        }
        return baseDirectory.resolve(expanded);
    }
}
