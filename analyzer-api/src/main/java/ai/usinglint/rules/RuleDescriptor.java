package ai.usinglint.rules;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Identity metadata of a rule: what hosts register, display and link to. Values are fixed per rule and never
 * consulted by the rule's own detection logic.
 *
 * @param messageFormat a {@link MessageFormat} pattern with positional arguments, e.g. {@code '{0}'}
 */
public record RuleDescriptor(
        String id,
        String title,
        String messageFormat,
        String category,
        Severity defaultSeverity,
        boolean enabledByDefault,
        String description,
        String helpLink) {

    public RuleDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(messageFormat, "messageFormat");
        Objects.requireNonNull(defaultSeverity, "defaultSeverity");
    }

    /**
     * Formats the message template. Arguments are substituted as plain strings; quotes in the template are literal,
     * so {@code "for '{0}'"} renders as {@code for 'Alias'}.
     */
    public String formatMessage(Object... args) {
        // MessageFormat treats a single quote as an escape, double them to keep them literal
        var pattern = messageFormat.replace("'", "''");
        var strings = new Object[args.length];
        for (int i = 0; i < args.length; i++) {
            strings[i] = String.valueOf(args[i]);
        }
        return new MessageFormat(pattern, Locale.ROOT).format(strings);
    }
}
