package ai.usinglint.analyzer;

/** Constants for the C# TreeSitter node type names the using-directive extractor relies on. */
public final class CSharpTreeSitterNodeTypes {

    // Scopes
    public static final String NAMESPACE_DECLARATION = "namespace_declaration";
    public static final String FILE_SCOPED_NAMESPACE_DECLARATION = "file_scoped_namespace_declaration";
    public static final String DECLARATION_LIST = "declaration_list";

    // Directives
    public static final String USING_DIRECTIVE = "using_directive";
    // Older grammars wrap the alias as `name_equals`; newer ones expose `identifier '=' type`
    public static final String NAME_EQUALS = "name_equals";

    public static final String COMMENT = "comment";

    // Anonymous tokens
    public static final String STATIC_KEYWORD = "static";
    public static final String EQUALS_TOKEN = "=";

    // Field names
    public static final String NAME_FIELD = "name";
    public static final String BODY_FIELD = "body";

    private CSharpTreeSitterNodeTypes() {
        // Utility class - no instantiation
    }
}
