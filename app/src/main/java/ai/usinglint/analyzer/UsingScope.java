package ai.usinglint.analyzer;

import ai.usinglint.rules.UsingDirective;
import java.util.List;

/**
 * The using directives declared directly in one lexical scope, in source order.
 *
 * @param name empty for the compilation unit, otherwise the namespace name as written
 */
public record UsingScope(Kind kind, String name, List<UsingDirective> directives) {

    public enum Kind {
        COMPILATION_UNIT,
        NAMESPACE
    }

    public UsingScope {
        directives = List.copyOf(directives);
    }

    public boolean isEmpty() {
        return directives.isEmpty();
    }
}
