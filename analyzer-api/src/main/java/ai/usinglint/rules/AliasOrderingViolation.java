package ai.usinglint.rules;

/**
 * A using-alias directive that appears before a directive it must follow.
 *
 * @param aliasName the alias introduced by the offending directive
 * @param requiredPredecessorName the unaliased name of the directive the alias must appear after
 * @param position location of the offending directive
 */
public record AliasOrderingViolation(String aliasName, String requiredPredecessorName, SourcePosition position) {

    /** Renders this violation with the given rule's message template. */
    public String message(RuleDescriptor descriptor) {
        return descriptor.formatMessage(aliasName, requiredPredecessorName);
    }
}
