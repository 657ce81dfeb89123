package com.nsscout.core.reader;

import com.nsscout.core.model.BooleanForm;
import com.nsscout.core.model.CharacterForm;
import com.nsscout.core.model.Form;
import com.nsscout.core.model.KeywordForm;
import com.nsscout.core.model.ListForm;
import com.nsscout.core.model.MapForm;
import com.nsscout.core.model.NilForm;
import com.nsscout.core.model.NumberForm;
import com.nsscout.core.model.ReaderConditionalForm;
import com.nsscout.core.model.RegexForm;
import com.nsscout.core.model.SetForm;
import com.nsscout.core.model.StringForm;
import com.nsscout.core.model.SymbolForm;
import com.nsscout.core.model.TaggedForm;
import com.nsscout.core.model.VectorForm;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads top-level Clojure forms from a character stream without evaluating anything.
 *
 * <p>The reader covers the syntax that can appear in source files: collections,
 * literals, quoting shorthands, metadata, tagged literals, discards, namespaced maps
 * and reader conditionals. It does not resolve syntax-quote, auto-resolved keywords
 * or data reader tags; those are returned structurally.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FormReader reader = new FormReader(new StringReader("(ns a.b) (def x 1)"), ReaderConfig.defaults());
 * Optional<Form> first = reader.read();   // (ns a.b)
 * }</pre>
 *
 * <p>A reader is single-use and not thread-safe. It never closes the underlying
 * {@link Reader}; the caller owns it.
 */
public class FormReader {

    private static final int EOF = -1;
    private static final int NONE = -2;

    private static final Pattern SYMBOL_PATTERN =
        Pattern.compile("[:]?([\\D&&[^/]].*/)?(/|[\\D&&[^/]][^/]*)");
    private static final Pattern INT_PATTERN = Pattern.compile(
        "([-+]?)(?:(0)|([1-9][0-9]*)|0[xX]([0-9A-Fa-f]+)|0([0-7]+)|([1-9][0-9]?)[rR]([0-9A-Za-z]+)|0[0-9]+)(N)?");
    private static final Pattern RATIO_PATTERN = Pattern.compile("([-+]?[0-9]+)/([0-9]+)");
    private static final Pattern FLOAT_PATTERN = Pattern.compile("([-+]?[0-9]+(\\.[0-9]*)?([eE][-+]?[0-9]+)?)(M)?");

    private static final SymbolForm QUOTE = SymbolForm.of("quote");
    private static final SymbolForm SYNTAX_QUOTE = SymbolForm.of("syntax-quote");
    private static final SymbolForm UNQUOTE = SymbolForm.of("clojure.core/unquote");
    private static final SymbolForm UNQUOTE_SPLICING = SymbolForm.of("clojure.core/unquote-splicing");
    private static final SymbolForm DEREF = SymbolForm.of("clojure.core/deref");
    private static final SymbolForm VAR = SymbolForm.of("var");
    private static final SymbolForm FN = SymbolForm.of("fn*");

    private static final KeywordForm TAG_KEY = KeywordForm.of("tag");
    private static final KeywordForm PARAM_TAGS_KEY = KeywordForm.of("param-tags");
    private static final String DEFAULT_FEATURE = "default";

    /** Result of a dispatch that produced no value: a discard or an unmatched conditional. */
    private static final Form NOTHING = new Form() {
        @Override
        public String toString() {
            return "<nothing>";
        }
    };

    private final Reader in;
    private final ReaderConfig config;

    private int pushedBack = NONE;
    private int line = 1;
    private int column = 0;
    private int previousColumn = 0;
    private boolean inFunctionLiteral;

    public FormReader(Reader in, ReaderConfig config) {
        this.in = Objects.requireNonNull(in, "in must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Reads the next top-level form.
     *
     * @return the form, or empty at end of stream
     * @throws IOException if the underlying reader fails
     * @throws ReaderException if the text is not readable as a form
     */
    public Optional<Form> read() throws IOException {
        while (true) {
            int ch = skipWhitespace();
            if (ch == EOF) {
                return Optional.empty();
            }
            Form form = dispatch(ch);
            if (form == NOTHING) {
                continue;
            }
            if (form instanceof Splice) {
                throw error("Reader conditional splicing not allowed at the top level");
            }
            return Optional.of(form);
        }
    }

    /**
     * Returns the remaining top-level forms as a lazy stream.
     *
     * <p>The stream reads on demand and can be consumed once. Reader errors surface as
     * {@link ReaderException} and I/O errors as {@link UncheckedIOException} from the
     * terminal operation.
     *
     * @return stream of forms in source order
     */
    public Stream<Form> forms() {
        Iterator<Form> iterator = new Iterator<>() {
            private Optional<Form> next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    try {
                        next = read();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }
                return next.isPresent();
            }

            @Override
            public Form next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Form form = next.get();
                next = null;
                return form;
            }
        };
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    // ==================== Character Input ====================

    private int next() throws IOException {
        int ch;
        if (pushedBack != NONE) {
            ch = pushedBack;
            pushedBack = NONE;
        } else {
            ch = in.read();
        }
        if (ch == '\n') {
            line++;
            previousColumn = column;
            column = 0;
        } else if (ch != EOF) {
            column++;
        }
        return ch;
    }

    private void unread(int ch) {
        if (ch == EOF) {
            return;
        }
        pushedBack = ch;
        if (ch == '\n') {
            line--;
            column = previousColumn;
        } else {
            column--;
        }
    }

    private int skipWhitespace() throws IOException {
        int ch = next();
        while (isWhitespace(ch)) {
            ch = next();
        }
        return ch;
    }

    private static boolean isWhitespace(int ch) {
        return ch != EOF && (Character.isWhitespace(ch) || ch == ',');
    }

    private static boolean isTerminatingMacro(int ch) {
        return switch (ch) {
            case '"', ';', '@', '^', '`', '~', '(', ')', '[', ']', '{', '}', '\\' -> true;
            default -> false;
        };
    }

    private static boolean isDigit(int ch) {
        return ch >= '0' && ch <= '9';
    }

    // ==================== Dispatch ====================

    private Form dispatch(int ch) throws IOException {
        if (isDigit(ch)) {
            return readNumber(ch);
        }
        return switch (ch) {
            case '"' -> new StringForm(readString());
            case ';' -> {
                skipLine();
                yield NOTHING;
            }
            case '\'' -> ListForm.of(QUOTE, readNext());
            case '@' -> ListForm.of(DEREF, readNext());
            case '`' -> ListForm.of(SYNTAX_QUOTE, readNext());
            case '~' -> readUnquote();
            case '^' -> readMeta();
            case '(' -> new ListForm(readDelimited(')'));
            case '[' -> new VectorForm(readDelimited(']'));
            case '{' -> readMap();
            case ')', ']', '}' -> throw error("Unmatched delimiter: " + (char) ch);
            case '\\' -> readCharacter();
            case '#' -> readDispatch();
            case '+', '-' -> {
                int following = next();
                unread(following);
                yield isDigit(following) ? readNumber(ch) : readSymbolOrKeyword(ch);
            }
            default -> readSymbolOrKeyword(ch);
        };
    }

    /**
     * Reads the next form in a position that requires exactly one value, such as the
     * target of a quote or of metadata.
     */
    private Form readNext() throws IOException {
        while (true) {
            int ch = skipWhitespace();
            if (ch == EOF) {
                throw error("EOF while reading");
            }
            Form form = dispatch(ch);
            if (form == NOTHING) {
                continue;
            }
            if (form instanceof Splice) {
                throw error("Reader conditional splicing not allowed outside a collection");
            }
            return form;
        }
    }

    private List<Form> readDelimited(char close) throws IOException {
        int startLine = line;
        List<Form> forms = new ArrayList<>();
        while (true) {
            int ch = skipWhitespace();
            if (ch == EOF) {
                throw error("EOF while reading, starting at line " + startLine);
            }
            if (ch == close) {
                return forms;
            }
            Form form = dispatch(ch);
            if (form == NOTHING) {
                continue;
            }
            if (form instanceof Splice splice) {
                forms.addAll(splice.forms());
            } else {
                forms.add(form);
            }
        }
    }

    // ==================== Tokens ====================

    private String readToken(int initial) throws IOException {
        StringBuilder sb = new StringBuilder().append((char) initial);
        while (true) {
            int ch = next();
            if (ch == EOF || isWhitespace(ch) || isTerminatingMacro(ch)) {
                unread(ch);
                return sb.toString();
            }
            sb.append((char) ch);
        }
    }

    private Form readNumber(int initial) throws IOException {
        String token = readToken(initial);
        if (INT_PATTERN.matcher(token).matches()
            || RATIO_PATTERN.matcher(token).matches()
            || FLOAT_PATTERN.matcher(token).matches()) {
            return new NumberForm(token);
        }
        throw error("Invalid number: " + token);
    }

    private Form readSymbolOrKeyword(int initial) throws IOException {
        String token = readToken(initial);
        switch (token) {
            case "nil":
                return NilForm.INSTANCE;
            case "true":
                return BooleanForm.TRUE;
            case "false":
                return BooleanForm.FALSE;
            default:
                break;
        }
        Form form = interpretToken(token);
        if (form == null) {
            throw error("Invalid token: " + token);
        }
        return form;
    }

    /**
     * Interprets a symbol or keyword token, returning null when the token is malformed.
     */
    private static Form interpretToken(String token) {
        boolean autoResolved = token.startsWith("::");
        String text = autoResolved ? token.substring(1) : token;
        Matcher m = SYMBOL_PATTERN.matcher(text);
        if (!m.matches()) {
            return null;
        }
        String ns = m.group(1);
        String name = m.group(2);
        if (ns != null && ns.endsWith(":/") || name.endsWith(":") || text.indexOf("::", 1) != -1) {
            return null;
        }
        if (text.startsWith(":")) {
            String body = text.substring(1);
            SymbolForm parts = SymbolForm.of(body);
            return new KeywordForm(parts.namespace(), parts.name(), autoResolved);
        }
        if (autoResolved) {
            return null;
        }
        return SymbolForm.of(text);
    }

    // ==================== Literals ====================

    private String readString() throws IOException {
        int startLine = line;
        StringBuilder sb = new StringBuilder();
        while (true) {
            int ch = next();
            if (ch == EOF) {
                throw error("EOF while reading string, starting at line " + startLine);
            }
            if (ch == '"') {
                return sb.toString();
            }
            if (ch == '\\') {
                sb.append(readEscape());
            } else {
                sb.append((char) ch);
            }
        }
    }

    private char readEscape() throws IOException {
        int ch = next();
        if (ch == EOF) {
            throw error("EOF while reading string");
        }
        switch (ch) {
            case 't':
                return '\t';
            case 'r':
                return '\r';
            case 'n':
                return '\n';
            case 'b':
                return '\b';
            case 'f':
                return '\f';
            case '\\':
            case '"':
                return (char) ch;
            case 'u':
                return (char) readUnicode(4, 16);
            default:
                if (isDigit(ch)) {
                    unread(ch);
                    int value = readUnicode(3, 8);
                    if (value > 0377) {
                        throw error("Octal escape sequence must be in range [0, 377]");
                    }
                    return (char) value;
                }
                throw error("Unsupported escape character: \\" + (char) ch);
        }
    }

    /**
     * Reads up to {@code length} digits in the given radix; unicode escapes need all four.
     */
    private int readUnicode(int length, int radix) throws IOException {
        int value = 0;
        int count = 0;
        while (count < length) {
            int ch = next();
            int digit = ch == EOF ? -1 : Character.digit(ch, radix);
            if (digit == -1) {
                unread(ch);
                break;
            }
            value = value * radix + digit;
            count++;
        }
        if (count == 0 || radix == 16 && count != length) {
            throw error("Invalid character length: " + count + ", should be: " + length);
        }
        return value;
    }

    private Form readCharacter() throws IOException {
        int ch = next();
        if (ch == EOF) {
            throw error("EOF while reading character");
        }
        String token = readToken(ch);
        if (token.length() == 1) {
            return new CharacterForm(token.charAt(0));
        }
        switch (token) {
            case "newline":
                return new CharacterForm('\n');
            case "space":
                return new CharacterForm(' ');
            case "tab":
                return new CharacterForm('\t');
            case "backspace":
                return new CharacterForm('\b');
            case "formfeed":
                return new CharacterForm('\f');
            case "return":
                return new CharacterForm('\r');
            default:
                break;
        }
        if (token.startsWith("u") && token.length() == 5) {
            int code = parseDigits(token.substring(1), 16, token);
            if (code >= 0xD800 && code <= 0xDFFF) {
                throw error("Invalid character constant: \\" + token);
            }
            return new CharacterForm((char) code);
        }
        if (token.startsWith("o") && token.length() <= 4) {
            int code = parseDigits(token.substring(1), 8, token);
            if (code > 0377) {
                throw error("Octal escape sequence must be in range [0, 377]");
            }
            return new CharacterForm((char) code);
        }
        throw error("Unsupported character: \\" + token);
    }

    private int parseDigits(String digits, int radix, String token) {
        try {
            return Integer.parseInt(digits, radix);
        } catch (NumberFormatException e) {
            throw error("Invalid character constant: \\" + token, e);
        }
    }

    private Form readMap() throws IOException {
        List<Form> forms = readDelimited('}');
        return toMap(forms);
    }

    private MapForm toMap(List<Form> forms) {
        if (forms.size() % 2 != 0) {
            throw error("Map literal must contain an even number of forms");
        }
        Map<Form, Form> entries = new LinkedHashMap<>();
        for (int i = 0; i < forms.size(); i += 2) {
            Form key = forms.get(i);
            if (entries.containsKey(key)) {
                throw error("Duplicate key: " + key);
            }
            entries.put(key, forms.get(i + 1));
        }
        return new MapForm(entries);
    }

    private Form readUnquote() throws IOException {
        int ch = next();
        if (ch == '@') {
            return ListForm.of(UNQUOTE_SPLICING, readNext());
        }
        unread(ch);
        return ListForm.of(UNQUOTE, readNext());
    }

    private void skipLine() throws IOException {
        int ch;
        do {
            ch = next();
        } while (ch != EOF && ch != '\n' && ch != '\r');
    }

    // ==================== Metadata ====================

    private Form readMeta() throws IOException {
        MapForm meta = toMetaMap(readNext());
        Form target = readNext();
        if (target instanceof SymbolForm symbol) {
            return symbol.withMeta(symbol.meta().merge(meta));
        }
        if (target instanceof ListForm || target instanceof VectorForm
            || target instanceof MapForm || target instanceof SetForm) {
            // metadata on collections is not needed for namespace discovery
            return target;
        }
        throw error("Metadata can only be applied to symbols and collections");
    }

    private MapForm toMetaMap(Form meta) {
        if (meta instanceof SymbolForm || meta instanceof StringForm) {
            return new MapForm(Map.of(TAG_KEY, meta));
        }
        if (meta instanceof KeywordForm) {
            return new MapForm(Map.of(meta, BooleanForm.TRUE));
        }
        if (meta instanceof VectorForm) {
            return new MapForm(Map.of(PARAM_TAGS_KEY, meta));
        }
        if (meta instanceof MapForm map) {
            return map;
        }
        throw error("Metadata must be Symbol, Keyword, String, Map or Vector");
    }

    // ==================== Dispatch Macros ====================

    private Form readDispatch() throws IOException {
        int ch = next();
        if (ch == EOF) {
            throw error("EOF while reading character");
        }
        switch (ch) {
            case '^':
                return readMeta();
            case '#':
                return readSymbolicValue();
            case '\'':
                return ListForm.of(VAR, readNext());
            case '"':
                return readRegex();
            case '(':
                return readFunctionLiteral();
            case '{':
                return readSet();
            case '=':
                throw error("Read-eval (#=) is not supported");
            case '!':
                skipLine();
                return NOTHING;
            case '<':
                throw error("Unreadable form");
            case '_':
                readNext();
                return NOTHING;
            case '?':
                return readConditional();
            case ':':
                return readNamespacedMap();
            default:
                unread(ch);
                return readTagged();
        }
    }

    private Form readSymbolicValue() throws IOException {
        int ch = skipWhitespace();
        if (ch == EOF) {
            throw error("EOF while reading");
        }
        String token = readToken(ch);
        return switch (token) {
            case "Inf", "-Inf", "NaN" -> new NumberForm("##" + token);
            default -> throw error("Unknown symbolic value: ##" + token);
        };
    }

    private Form readRegex() throws IOException {
        int startLine = line;
        StringBuilder sb = new StringBuilder();
        while (true) {
            int ch = next();
            if (ch == EOF) {
                throw error("EOF while reading regex, starting at line " + startLine);
            }
            if (ch == '"') {
                break;
            }
            sb.append((char) ch);
            if (ch == '\\') {
                int escaped = next();
                if (escaped == EOF) {
                    throw error("EOF while reading regex, starting at line " + startLine);
                }
                sb.append((char) escaped);
            }
        }
        String pattern = sb.toString();
        try {
            Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw error("Invalid regex: " + e.getDescription(), e);
        }
        return new RegexForm(pattern);
    }

    private Form readFunctionLiteral() throws IOException {
        if (inFunctionLiteral) {
            throw error("Nested #()s are not allowed");
        }
        inFunctionLiteral = true;
        try {
            return ListForm.of(FN, new ListForm(readDelimited(')')));
        } finally {
            inFunctionLiteral = false;
        }
    }

    private Form readSet() throws IOException {
        List<Form> elements = readDelimited('}');
        Set<Form> seen = new HashSet<>();
        for (Form element : elements) {
            if (!seen.add(element)) {
                throw error("Duplicate key: " + element);
            }
        }
        return new SetForm(elements);
    }

    private Form readTagged() throws IOException {
        Form tag = readNext();
        if (!(tag instanceof SymbolForm symbol)) {
            throw error("Reader tag must be a symbol");
        }
        return new TaggedForm(symbol, readNext());
    }

    private Form readNamespacedMap() throws IOException {
        boolean auto = false;
        int ch = next();
        if (ch == ':') {
            auto = true;
            ch = next();
        }
        String ns = null;
        if (ch != EOF && !isWhitespace(ch) && ch != '{') {
            String token = readToken(ch);
            Form sym = interpretToken(token);
            if (!(sym instanceof SymbolForm symbol) || symbol.isQualified()) {
                throw error("Namespaced map must specify a valid namespace: " + token);
            }
            ns = symbol.name();
            ch = next();
        } else if (!auto) {
            throw error("Namespaced map must specify a namespace");
        }
        while (isWhitespace(ch)) {
            ch = next();
        }
        if (ch != '{') {
            throw error("Namespaced map must specify a map");
        }

        List<Form> forms = readDelimited('}');
        if (forms.size() % 2 != 0) {
            throw error("Namespaced map literal must contain an even number of forms");
        }
        List<Form> qualified = new ArrayList<>(forms.size());
        for (int i = 0; i < forms.size(); i += 2) {
            qualified.add(qualifyKey(forms.get(i), ns, auto));
            qualified.add(forms.get(i + 1));
        }
        return toMap(qualified);
    }

    private static Form qualifyKey(Form key, String ns, boolean auto) {
        if (key instanceof KeywordForm keyword && !keyword.autoResolved()) {
            if (keyword.namespace() == null) {
                return new KeywordForm(ns, keyword.name(), auto);
            }
            if (keyword.namespace().equals("_")) {
                return KeywordForm.of(keyword.name());
            }
        } else if (key instanceof SymbolForm symbol) {
            if (symbol.namespace() == null && ns != null) {
                return new SymbolForm(ns, symbol.name(), symbol.meta());
            }
            if ("_".equals(symbol.namespace())) {
                return new SymbolForm(null, symbol.name(), symbol.meta());
            }
        }
        return key;
    }

    // ==================== Reader Conditionals ====================

    private Form readConditional() throws IOException {
        int ch = next();
        boolean splicing = false;
        if (ch == '@') {
            splicing = true;
            ch = next();
        }
        while (isWhitespace(ch)) {
            ch = next();
        }
        if (ch == EOF) {
            throw error("EOF while reading character");
        }
        if (ch != '(') {
            throw error("read-cond body must be a list");
        }

        return switch (config.conditionalMode()) {
            case DISALLOW -> throw error("Conditional read not allowed");
            case PRESERVE -> preserveConditional(splicing);
            case ALLOW -> selectConditional(splicing);
        };
    }

    private Form preserveConditional(boolean splicing) throws IOException {
        List<Form> branches = readDelimited(')');
        if (branches.size() % 2 != 0) {
            throw error("read-cond requires an even number of forms");
        }
        return new ReaderConditionalForm(splicing, new ListForm(branches));
    }

    private Form selectConditional(boolean splicing) throws IOException {
        int startLine = line;
        Form selected = NOTHING;
        while (true) {
            int ch = skipWhitespace();
            if (ch == EOF) {
                throw error("EOF while reading, starting at line " + startLine);
            }
            if (ch == ')') {
                break;
            }
            Form feature = dispatch(ch);
            if (feature == NOTHING) {
                continue;
            }
            if (!(feature instanceof KeywordForm keyword)) {
                throw error("Feature should be a keyword: " + feature);
            }
            if (skipToBranch() == ')') {
                throw error("read-cond requires an even number of forms");
            }
            Form branch = readNext();
            if (selected == NOTHING && keyword.namespace() == null && !keyword.autoResolved()
                && (config.hasFeature(keyword.name()) || DEFAULT_FEATURE.equals(keyword.name()))) {
                selected = branch;
            }
        }

        if (selected == NOTHING || !splicing) {
            return selected;
        }
        if (selected instanceof ListForm list) {
            return new Splice(list.elements());
        }
        if (selected instanceof VectorForm vector) {
            return new Splice(vector.elements());
        }
        throw error("Spliced form list in read-cond-splicing must be a list or vector");
    }

    /**
     * Skips whitespace after a feature keyword and reports the next character without consuming it.
     */
    private int skipToBranch() throws IOException {
        int ch = skipWhitespace();
        unread(ch);
        return ch;
    }

    // ==================== Errors ====================

    private ReaderException error(String message) {
        return new ReaderException(message, line, column);
    }

    private ReaderException error(String message, Throwable cause) {
        return new ReaderException(message, line, column, cause);
    }

    /**
     * Forms produced by {@code #?@} that are spliced into the enclosing collection.
     */
    private record Splice(List<Form> forms) implements Form {
    }
}
