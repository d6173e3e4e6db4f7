package ai.usinglint.analyzer;

import java.util.List;
import java.util.Locale;

/**
 * Recognizes generated C# files, which style rules leave alone: well-known generated file name suffixes and an
 * {@code <auto-generated>} marker in the file's leading comments.
 */
public final class GeneratedCodeDetector {

    private static final List<String> GENERATED_SUFFIXES = List.of(
            ".designer.cs", ".generated.cs", ".g.cs", ".g.i.cs", ".assemblyattributes.cs");

    private static final String TEMPORARY_GENERATED_PREFIX = "temporarygeneratedfile_";

    private static final List<String> GENERATED_MARKERS = List.of("<auto-generated", "<autogenerated");

    private GeneratedCodeDetector() {}

    public static boolean isGenerated(String fileName, String source) {
        return hasGeneratedName(fileName) || hasGeneratedHeader(source);
    }

    /** Checks only the file name; {@code fileName} may be a path. */
    public static boolean hasGeneratedName(String fileName) {
        var baseName = fileName.replace('\\', '/');
        baseName = baseName.substring(baseName.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        if (baseName.startsWith(TEMPORARY_GENERATED_PREFIX)) {
            return true;
        }
        for (var suffix : GENERATED_SUFFIXES) {
            if (baseName.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    /** Scans the comments before the first line of code for an auto-generated marker. */
    public static boolean hasGeneratedHeader(String source) {
        boolean inBlockComment = false;
        for (var rawLine : source.lines().toList()) {
            var line = rawLine.strip();
            if (line.startsWith("\uFEFF")) {
                line = line.substring(1).strip();
            }
            if (inBlockComment) {
                if (containsMarker(line)) {
                    return true;
                }
                if (line.contains("*/")) {
                    inBlockComment = false;
                    if (!line.substring(line.indexOf("*/") + 2).isBlank()) {
                        return false;
                    }
                }
                continue;
            }
            if (line.isEmpty() || line.startsWith("#region") || line.startsWith("#endregion")) {
                continue;
            }
            if (line.startsWith("//")) {
                if (containsMarker(line)) {
                    return true;
                }
                continue;
            }
            if (line.startsWith("/*")) {
                if (containsMarker(line)) {
                    return true;
                }
                var afterOpen = line.substring(2);
                if (!afterOpen.contains("*/")) {
                    inBlockComment = true;
                } else if (!afterOpen.substring(afterOpen.indexOf("*/") + 2).isBlank()) {
                    return false;
                }
                continue;
            }
            return false;
        }
        return false;
    }

    private static boolean containsMarker(String line) {
        var lower = line.toLowerCase(Locale.ROOT);
        for (var marker : GENERATED_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
