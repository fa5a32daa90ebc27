package domain.output;

import java.nio.file.Path;

/**
 * Where the formatted copy of an input file goes.
 * <p>
 * Layout mirrors the input: {@code <outDir>/<path relative to inputRoot>}.
 * A single-file input (inputRoot is the file itself) lands as {@code <outDir>/<fileName>}.
 */
public final class FormattedFilePolicy {

    private FormattedFilePolicy() {
    }

    public static Path target(Path inputRoot, Path file, Path outDir) {
        if (file == null) throw new IllegalArgumentException("file is null");
        if (outDir == null) throw new IllegalArgumentException("outDir is null");
        return outDir.resolve(relativeName(inputRoot, file)).normalize();
    }

    /**
     * Relative, forward-slash name of {@code file} below {@code inputRoot}; the bare file name when
     * the file is not below it. Used for report rows and warning sources.
     */
    public static String relativeName(Path inputRoot, Path file) {
        if (file == null) return "";
        Path f = file.toAbsolutePath().normalize();
        if (inputRoot != null) {
            Path root = inputRoot.toAbsolutePath().normalize();
            if (!root.equals(f) && f.startsWith(root)) {
                return root.relativize(f).toString().replace('\\', '/');
            }
        }
        Path name = f.getFileName();
        return name == null ? f.toString() : name.toString();
    }
}
