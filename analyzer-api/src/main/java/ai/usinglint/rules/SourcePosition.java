package ai.usinglint.rules;

/**
 * Location of a directive in its source file. Lines and columns are 1-based.
 *
 * <p>The ordering checker never inspects positions; it only copies them from the offending directive into the
 * violation it reports.
 */
public record SourcePosition(String file, int line, int column) {

    public static final SourcePosition UNKNOWN = new SourcePosition("", 0, 0);

    @Override
    public String toString() {
        return file + "(" + line + "," + column + ")";
    }
}
