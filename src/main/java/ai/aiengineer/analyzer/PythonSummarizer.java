package ai.aiengineer.analyzer;

import com.google.common.base.Splitter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

/**
 * Tree-sitter backed outline of a Python module. Only the module's own top-level statements are looked at; anything
 * nested inside a class, a function or a control-flow block is invisible to the summary.
 *
 * <p>The outline has up to four sections, in this order: the module docstring, top-level classes, top-level
 * functions, top-level assignments. Classes and functions are rendered as their header lines (decorators excluded)
 * followed by their docstring; assignments as their first source line.
 */
public final class PythonSummarizer implements StructuralSummarizer {
    private static final Logger logger = LogManager.getLogger(PythonSummarizer.class);

    private static final TSLanguage PY_LANGUAGE = new TreeSitterPython();
    private static final Splitter LINE_SPLITTER = Splitter.on('\n');

    private static final String CLASS_DEFINITION = "class_definition";
    private static final String FUNCTION_DEFINITION = "function_definition";
    private static final String DECORATED_DEFINITION = "decorated_definition";
    private static final String EXPRESSION_STATEMENT = "expression_statement";
    private static final String ASSIGNMENT = "assignment";
    private static final String STRING = "string";
    private static final String COMMENT = "comment";
    private static final Set<String> LEGACY_STATEMENTS = Set.of("print_statement", "exec_statement");

    @Override
    public String summarize(String source) {
        // TSParser is not threadsafe, so each call gets its own
        var parser = new TSParser();
        if (!parser.setLanguage(PY_LANGUAGE)) {
            throw new IllegalStateException("Unable to load the tree-sitter Python grammar");
        }
        TSTree tree = parser.parseString(null, source);
        TSNode root = tree.getRootNode();
        if (root.isNull()) {
            throw new SourceParseException("Parser produced no tree", 1);
        }
        if (root.hasError()) {
            int line = firstErrorLine(root);
            throw new SourceParseException("Syntax error at line " + line, line);
        }
        TSNode legacy = findLegacyStatement(root);
        if (legacy != null) {
            int line = legacy.getStartPoint().getRow() + 1;
            throw new SourceParseException(
                    "Python 2 %s is not valid Python 3, at line %d".formatted(legacy.getType(), line), line);
        }

        var src = new Source(source);
        List<String> classes = new ArrayList<>();
        List<String> functions = new ArrayList<>();
        List<String> variables = new ArrayList<>();

        for (int i = 0; i < root.getNamedChildCount(); i++) {
            TSNode statement = root.getNamedChild(i);
            TSNode definition = unwrapDecorated(statement);
            switch (definition.getType()) {
                case CLASS_DEFINITION -> classes.add(renderDefinition(definition, src));
                case FUNCTION_DEFINITION -> functions.add(renderDefinition(definition, src));
                case EXPRESSION_STATEMENT -> {
                    if (bindsValue(definition)) {
                        variables.add(src.line(definition.getStartPoint().getRow()).strip());
                    }
                }
                default -> logger.trace("Ignoring top-level {}", definition.getType());
            }
        }

        List<String> sections = new ArrayList<>();
        moduleDocstring(root, src).ifPresent(doc -> sections.add("Module Description:\n" + doc + "\n"));
        if (!classes.isEmpty()) {
            sections.add("Classes:\n" + String.join("\n", classes) + "\n");
        }
        if (!functions.isEmpty()) {
            sections.add("Functions:\n" + String.join("\n", functions) + "\n");
        }
        if (!variables.isEmpty()) {
            sections.add("Variables:\n" + String.join("\n", variables) + "\n");
        }
        logger.trace(
                "Summarized {} classes, {} functions, {} variables", classes.size(), functions.size(), variables.size());
        return String.join("\n", sections).strip();
    }

    private static TSNode unwrapDecorated(TSNode node) {
        if (DECORATED_DEFINITION.equals(node.getType())) {
            TSNode inner = node.getChildByFieldName("definition");
            if (inner != null && !inner.isNull()) {
                return inner;
            }
        }
        return node;
    }

    /** `x = 1`, `a = b = 1`, `x: int = 1`; not `x += 1` and not a bare `x: int`. */
    private static boolean bindsValue(TSNode expressionStatement) {
        if (expressionStatement.getNamedChildCount() != 1) {
            return false;
        }
        TSNode child = expressionStatement.getNamedChild(0);
        if (!ASSIGNMENT.equals(child.getType())) {
            return false;
        }
        TSNode right = child.getChildByFieldName("right");
        return right != null && !right.isNull();
    }

    private String renderDefinition(TSNode definition, Source src) {
        var signature = headerLines(definition, src);
        var body = definition.getChildByFieldName("body");
        var doc = body == null || body.isNull() ? Optional.<String>empty() : docstringOf(body, src);
        return doc.map(d -> signature + "\n\"\"\"\n" + d + "\n\"\"\"").orElse(signature);
    }

    /**
     * Lines from the def/class keyword through the first one whose code part ends with ':'. The scan never runs
     * past the first line of the body, so a one-line `class A: pass` stays a single line.
     */
    private static String headerLines(TSNode definition, Source src) {
        int start = definition.getStartPoint().getRow();
        TSNode body = definition.getChildByFieldName("body");
        int last = body == null || body.isNull()
                ? definition.getEndPoint().getRow()
                : body.getStartPoint().getRow();
        last = Math.min(last, src.lineCount() - 1);

        List<String> lines = new ArrayList<>();
        for (int row = start; row <= last; row++) {
            String line = src.line(row);
            lines.add(line);
            if (codePart(line).endsWith(":")) {
                break;
            }
        }
        return String.join("\n", lines).strip();
    }

    private static Optional<String> moduleDocstring(TSNode module, Source src) {
        return docstringOf(module, src);
    }

    /** The first statement of a module or block, if it is a plain string literal. */
    private static Optional<String> docstringOf(TSNode container, Source src) {
        TSNode first = firstStatement(container);
        if (first == null || !EXPRESSION_STATEMENT.equals(first.getType()) || first.getNamedChildCount() != 1) {
            return Optional.empty();
        }
        TSNode literal = first.getNamedChild(0);
        if (!STRING.equals(literal.getType())) {
            return Optional.empty();
        }
        return stringValue(src.slice(literal))
                .map(PythonSummarizer::cleanDocstring)
                .filter(doc -> !doc.isEmpty());
    }

    private static @Nullable TSNode firstStatement(TSNode container) {
        for (int i = 0; i < container.getNamedChildCount(); i++) {
            TSNode child = container.getNamedChild(i);
            if (!COMMENT.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    /** Value of a string literal, or empty for bytes and f-strings, which never count as docstrings. */
    static Optional<String> stringValue(String literal) {
        int prefixEnd = 0;
        while (prefixEnd < literal.length() && Character.isLetter(literal.charAt(prefixEnd))) {
            prefixEnd++;
        }
        String prefix = literal.substring(0, prefixEnd).toLowerCase(Locale.ROOT);
        if (prefix.contains("b") || prefix.contains("f")) {
            return Optional.empty();
        }
        String rest = literal.substring(prefixEnd);
        int quoteLength = rest.startsWith("\"\"\"") || rest.startsWith("'''") ? 3 : 1;
        if (rest.length() < 2 * quoteLength) {
            return Optional.empty();
        }
        String body = rest.substring(quoteLength, rest.length() - quoteLength);
        return Optional.of(prefix.contains("r") ? body : unescape(body));
    }

    private static String unescape(String s) {
        var sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\' || i + 1 >= s.length()) {
                sb.append(c);
                continue;
            }
            char next = s.charAt(++i);
            switch (next) {
                case '\n' -> {} // line continuation
                case '\\' -> sb.append('\\');
                case '\'' -> sb.append('\'');
                case '"' -> sb.append('"');
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                default -> sb.append('\\').append(next);
            }
        }
        return sb.toString();
    }

    /**
     * Conventional docstring cleanup: tabs expanded, first line left-stripped, the common indentation of the
     * remaining lines removed, leading and trailing empty lines dropped.
     */
    static String cleanDocstring(String doc) {
        List<String> lines = new ArrayList<>(LINE_SPLITTER.splitToList(expandTabs(doc)));
        int margin = Integer.MAX_VALUE;
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            int content = line.stripLeading().length();
            if (content > 0) {
                margin = Math.min(margin, line.length() - content);
            }
        }
        lines.set(0, lines.get(0).stripLeading());
        if (margin < Integer.MAX_VALUE) {
            for (int i = 1; i < lines.size(); i++) {
                String line = lines.get(i);
                lines.set(i, line.substring(Math.min(margin, line.length())));
            }
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        return String.join("\n", lines);
    }

    private static String expandTabs(String s) {
        if (s.indexOf('\t') < 0) {
            return s;
        }
        var sb = new StringBuilder();
        int column = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\t') {
                int spaces = 8 - (column % 8);
                sb.append(" ".repeat(spaces));
                column += spaces;
            } else {
                sb.append(c);
                column = c == '\n' || c == '\r' ? 0 : column + 1;
            }
        }
        return sb.toString();
    }

    /** The line with any trailing comment removed; a '#' inside a quoted string is not a comment. */
    static String codePart(String line) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '#') {
                return line.substring(0, i).stripTrailing();
            }
        }
        return line.stripTrailing();
    }

    /**
     * The grammar still accepts the Python 2 {@code print x} and {@code exec code} statements, which a Python 3
     * interpreter rejects. Returns the first one in source order, if any.
     */
    private static @Nullable TSNode findLegacyStatement(TSNode node) {
        if (LEGACY_STATEMENTS.contains(node.getType())) {
            return node;
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode found = findLegacyStatement(node.getNamedChild(i));
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static int firstErrorLine(TSNode node) {
        if ("ERROR".equals(node.getType()) || node.isMissing()) {
            return node.getStartPoint().getRow() + 1;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child.hasError() || child.isMissing()) {
                return firstErrorLine(child);
            }
        }
        return node.getStartPoint().getRow() + 1;
    }

    /** Source text addressed both by tree-sitter byte offsets and by row. */
    private static final class Source {
        private final byte[] bytes;
        private final List<String> lines;

        Source(String text) {
            this.bytes = text.getBytes(StandardCharsets.UTF_8);
            this.lines = LINE_SPLITTER.splitToList(text);
        }

        String slice(TSNode node) {
            int start = Math.min(node.getStartByte(), bytes.length);
            int end = Math.min(node.getEndByte(), bytes.length);
            return new String(bytes, start, end - start, StandardCharsets.UTF_8);
        }

        String line(int row) {
            return row < lines.size() ? lines.get(row) : "";
        }

        int lineCount() {
            return lines.size();
        }
    }
}
