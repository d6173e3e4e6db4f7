package ai.usinglint.analyzer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** AST helpers shared by the TreeSitter based extractors. */
public final class ASTTraversalUtils {
    private static final Logger log = LogManager.getLogger(ASTTraversalUtils.class);

    private ASTTraversalUtils() {}

    /** Returns the direct children of {@code parent} whose type matches, in source order. */
    public static List<TSNode> childrenOfType(@Nullable TSNode parent, String nodeType) {
        return children(parent, child -> nodeType.equals(child.getType()));
    }

    /** Returns the direct, non-null children of {@code parent} accepted by the predicate, in source order. */
    public static List<TSNode> children(@Nullable TSNode parent, Predicate<TSNode> predicate) {
        var results = new ArrayList<TSNode>();
        if (parent == null || parent.isNull()) {
            return results;
        }
        for (int i = 0; i < parent.getChildCount(); i++) {
            var child = parent.getChild(i);
            if (child != null && !child.isNull() && predicate.test(child)) {
                results.add(child);
            }
        }
        return results;
    }

    /** Returns the named child with the given field name, or null if absent. */
    public static @Nullable TSNode fieldChild(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return child == null || child.isNull() ? null : child;
    }

    /**
     * Extracts text from a TSNode using the file content. TreeSitter reports UTF-8 byte offsets, which are converted
     * to character positions before slicing.
     */
    public static String extractNodeText(@Nullable TSNode node, String fileContent) {
        if (node == null || node.isNull()) {
            return "";
        }
        return safeSubstringFromByteOffsets(fileContent, node.getStartByte(), node.getEndByte())
                .trim();
    }

    /**
     * Safely extracts a substring using UTF-8 byte offsets. Out of range offsets are clamped or produce an empty
     * string rather than an exception.
     */
    public static String safeSubstringFromByteOffsets(String source, int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            log.warn("Requested invalid byte range for source text: startByte={}, endByte={}", startByte, endByte);
            return "";
        }
        if (startByte == endByte) {
            return "";
        }

        byte[] sourceBytes = source.getBytes(StandardCharsets.UTF_8);
        if (startByte >= sourceBytes.length) {
            log.warn("Start byte offset {} exceeds source byte length {}", startByte, sourceBytes.length);
            return "";
        }
        if (endByte > sourceBytes.length) {
            log.warn("End byte offset {} exceeds source byte length {}, truncating", endByte, sourceBytes.length);
            endByte = sourceBytes.length;
        }
        return new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }
}
