package ai.usinglint.rules;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * SA1209: a using-alias directive must not be placed before a regular using directive of the same scope.
 *
 * <p>Alias directives can change the meaning of the code that follows them, so they are kept together below the
 * plain directives. The host calls {@link #check(List)} once per scope (the compilation unit, then each namespace);
 * scopes are checked independently and violations never cross them.
 *
 * <p>All violations of one scope name the same predecessor: the last directive of the scope that is not itself a
 * pending alias (the last non-alias directive, or the final directive when that one is an alias).
 */
public final class UsingAliasOrderingChecker {

    public static final String DIAGNOSTIC_ID = "SA1209";

    public static final RuleDescriptor DESCRIPTOR = new RuleDescriptor(
            DIAGNOSTIC_ID,
            "Using alias directives must be placed after other using directives",
            "Using alias directive for '{0}' must appear after directive for '{1}'",
            "StyleCop.CSharp.OrderingRules",
            Severity.WARNING,
            true,
            "A using-alias directive is positioned before a regular using directive.",
            "http://www.stylecop.com/docs/SA1209.html");

    private static final String ALIAS_QUALIFIER = "::";

    private UsingAliasOrderingChecker() {}

    /**
     * Checks one scope.
     *
     * @param directives the scope's directives, in source order; the result depends on this order and the list is
     *     neither sorted nor deduplicated here
     * @return the violations in source order, empty when the scope is clean
     */
    public static List<AliasOrderingViolation> check(List<UsingDirective> directives) {
        @Nullable UsingDirective placeAfter = null;
        @Nullable List<UsingDirective> toReport = null;

        for (int i = 0; i < directives.size(); i++) {
            var directive = directives.get(i);
            boolean notLast = i + 1 < directives.size();
            if (directive.hasAlias() && notLast) {
                var next = directives.get(i + 1);
                if (!next.hasAlias() && !next.isStatic()) {
                    if (toReport == null) {
                        toReport = new ArrayList<>();
                    }
                    toReport.add(directive);
                }
            } else {
                placeAfter = directive;
            }
        }

        if (toReport == null || placeAfter == null) {
            return List.of();
        }

        var predecessorName = unaliasedName(placeAfter.name());
        var violations = new ArrayList<AliasOrderingViolation>(toReport.size());
        for (var directive : toReport) {
            violations.add(new AliasOrderingViolation(
                    requireNonNull(directive.alias()), predecessorName, directive.position()));
        }
        return List.copyOf(violations);
    }

    /** Strips a leading {@code alias::} qualifier, keeping everything after the first {@code ::}. */
    public static String unaliasedName(String name) {
        int doubleColon = name.indexOf(ALIAS_QUALIFIER);
        if (doubleColon >= 0) {
            return name.substring(doubleColon + ALIAS_QUALIFIER.length());
        }
        return name;
    }
}
