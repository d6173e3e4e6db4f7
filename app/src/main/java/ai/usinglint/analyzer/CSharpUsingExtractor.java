package ai.usinglint.analyzer;

import static ai.usinglint.analyzer.CSharpTreeSitterNodeTypes.*;

import ai.usinglint.rules.SourcePosition;
import ai.usinglint.rules.UsingDirective;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterCSharp;

/**
 * Parses C# source with TreeSitter and collects the using directives of every scope: the compilation unit, then each
 * namespace declaration (block or file-scoped, at any depth) in source order.
 *
 * <p>Instances may be shared between threads; each thread parses with its own TSParser.
 */
public final class CSharpUsingExtractor {
    private static final Logger log = LogManager.getLogger(CSharpUsingExtractor.class);

    private final ThreadLocal<TSLanguage> threadLocalLanguage = ThreadLocal.withInitial(TreeSitterCSharp::new);
    private final ThreadLocal<TSParser> threadLocalParser = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        if (!parser.setLanguage(threadLocalLanguage.get())) {
            log.error("Failed to set C# language on TSParser");
        }
        return parser;
    });

    /**
     * Extracts the scopes of one file.
     *
     * @param source the file content
     * @param fileName the name recorded in each directive's position
     * @return the compilation unit scope followed by one scope per namespace; empty if parsing failed
     */
    public List<UsingScope> extract(String source, String fileName) {
        TSTree tree = threadLocalParser.get().parseString(null, source);
        TSNode root = tree.getRootNode();
        if (root == null || root.isNull()) {
            log.warn("Parsing failed or produced null root node for {}", fileName);
            return List.of();
        }
        if (root.hasError()) {
            log.debug("{} contains syntax errors; extracting using directives from the recovered tree", fileName);
        }

        // Usings after `namespace X;` belong to that namespace even when the grammar parses them as root siblings
        var fileScoped = ASTTraversalUtils.childrenOfType(root, FILE_SCOPED_NAMESPACE_DECLARATION).stream()
                .findFirst()
                .orElse(null);
        var unitUsings = ASTTraversalUtils.childrenOfType(root, USING_DIRECTIVE).stream()
                .filter(n -> fileScoped == null || n.getStartByte() < fileScoped.getStartByte())
                .toList();

        var scopes = new ArrayList<UsingScope>();
        scopes.add(new UsingScope(UsingScope.Kind.COMPILATION_UNIT, "", toDirectives(unitUsings, source, fileName)));
        collectNamespaces(root, source, fileName, scopes);
        log.trace("Extracted {} scopes from {}", scopes.size(), fileName);
        return scopes;
    }

    private void collectNamespaces(TSNode container, String source, String fileName, List<UsingScope> scopes) {
        for (var child : ASTTraversalUtils.children(container, c -> true)) {
            var type = child.getType();
            if (NAMESPACE_DECLARATION.equals(type)) {
                var body = ASTTraversalUtils.fieldChild(child, BODY_FIELD);
                if (body == null) {
                    body = ASTTraversalUtils.childrenOfType(child, DECLARATION_LIST).stream()
                            .findFirst()
                            .orElse(null);
                }
                scopes.add(namespaceScope(child, body, source, fileName));
                if (body != null) {
                    collectNamespaces(body, source, fileName, scopes);
                }
            } else if (FILE_SCOPED_NAMESPACE_DECLARATION.equals(type)) {
                var usings = new ArrayList<>(ASTTraversalUtils.childrenOfType(child, USING_DIRECTIVE));
                usings.addAll(ASTTraversalUtils.children(
                        container,
                        c -> USING_DIRECTIVE.equals(c.getType()) && c.getStartByte() >= child.getEndByte()));
                usings.sort(Comparator.comparingInt(TSNode::getStartByte));
                var name = ASTTraversalUtils.extractNodeText(ASTTraversalUtils.fieldChild(child, NAME_FIELD), source);
                scopes.add(new UsingScope(UsingScope.Kind.NAMESPACE, name, toDirectives(usings, source, fileName)));
                collectNamespaces(child, source, fileName, scopes);
            }
        }
    }

    private UsingScope namespaceScope(TSNode namespace, @Nullable TSNode body, String source, String fileName) {
        var name = ASTTraversalUtils.extractNodeText(ASTTraversalUtils.fieldChild(namespace, NAME_FIELD), source);
        var directives = body == null ? List.<UsingDirective>of() : directivesOf(body, source, fileName);
        return new UsingScope(UsingScope.Kind.NAMESPACE, name, directives);
    }

    private List<UsingDirective> directivesOf(TSNode container, String source, String fileName) {
        return toDirectives(ASTTraversalUtils.childrenOfType(container, USING_DIRECTIVE), source, fileName);
    }

    private List<UsingDirective> toDirectives(List<TSNode> nodes, String source, String fileName) {
        var directives = new ArrayList<UsingDirective>();
        for (var node : nodes) {
            var directive = toDirective(node, source, fileName);
            if (directive != null) {
                directives.add(directive);
            }
        }
        return directives;
    }

    /**
     * Converts a {@code using_directive} node. Handles both grammar shapes for aliases: {@code identifier '=' type}
     * and a {@code name_equals} wrapper.
     */
    @Nullable
    UsingDirective toDirective(TSNode node, String source, String fileName) {
        boolean isStatic = false;
        boolean hasEquals = false;
        @Nullable TSNode nameEquals = null;
        var named = new ArrayList<TSNode>();

        for (var child : ASTTraversalUtils.children(node, c -> true)) {
            var type = child.getType();
            if (!child.isNamed()) {
                if (STATIC_KEYWORD.equals(type)) {
                    isStatic = true;
                } else if (EQUALS_TOKEN.equals(type)) {
                    hasEquals = true;
                }
            } else if (NAME_EQUALS.equals(type)) {
                nameEquals = child;
            } else if (!COMMENT.equals(type)) {
                named.add(child);
            }
        }

        if (named.isEmpty()) {
            log.debug("Skipping using directive without a name at byte {} in {}", node.getStartByte(), fileName);
            return null;
        }

        @Nullable String alias = null;
        if (nameEquals != null) {
            var aliasNode = nameEquals.getNamedChildCount() > 0 ? nameEquals.getNamedChild(0) : nameEquals;
            alias = ASTTraversalUtils.extractNodeText(aliasNode, source);
        } else if (hasEquals && named.size() >= 2) {
            alias = ASTTraversalUtils.extractNodeText(named.get(0), source);
        }
        if (alias != null && alias.isBlank()) {
            alias = null;
        }

        var target = ASTTraversalUtils.extractNodeText(named.get(named.size() - 1), source);
        var point = node.getStartPoint();
        var position = new SourcePosition(fileName, point.getRow() + 1, point.getColumn() + 1);
        return new UsingDirective(alias, target, isStatic, position);
    }
}
