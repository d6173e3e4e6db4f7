package ai.usinglint.rules;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * One {@code using} directive of a scope, in the shape the ordering checker consumes.
 *
 * @param alias the alias name for {@code using A = B;} forms, or null for plain and static directives
 * @param name the imported namespace or type path as written, possibly qualified as {@code global::System}
 * @param isStatic true for {@code using static} directives
 * @param position where the directive starts
 */
public record UsingDirective(@Nullable String alias, String name, boolean isStatic, SourcePosition position) {

    public UsingDirective {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(position, "position");
        if (alias != null && alias.isBlank()) {
            throw new IllegalArgumentException("Alias must not be blank for directive '" + name + "'");
        }
    }

    public static UsingDirective plain(String name, SourcePosition position) {
        return new UsingDirective(null, name, false, position);
    }

    public static UsingDirective staticImport(String name, SourcePosition position) {
        return new UsingDirective(null, name, true, position);
    }

    public static UsingDirective aliased(String alias, String name, SourcePosition position) {
        return new UsingDirective(alias, name, false, position);
    }

    public boolean hasAlias() {
        return alias != null;
    }
}
