package org.fluxgen.compiler.types;

import org.fluxgen.compiler.api.ResolverException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Recursive-descent parser for target-language type expressions such as
 * {@code map[string][]*fmt.Stringer} or {@code func(a int, b ...string) (n int, err error)}.
 * <p>
 * Type names are looked up through the supplied function; predeclared names are
 * resolved directly. Unknown names resolve to whatever the lookup returns, typically
 * the wildcard.
 */
public final class TypeExpressionParser {

    private final List<String> tokens;
    private final Function<String, Type> namedLookup;
    private final String source;
    private int pos;

    private TypeExpressionParser(String source, Function<String, Type> namedLookup) throws ResolverException {
        this.source = source;
        this.tokens = tokenize(source);
        this.namedLookup = namedLookup;
    }

    /**
     * Parses a complete type expression.
     *
     * @param source      The expression text.
     * @param namedLookup Resolves (possibly qualified) type names that are not predeclared.
     * @return The parsed type.
     * @throws ResolverException if the text is not a well-formed type expression.
     */
    public static Type parse(String source, Function<String, Type> namedLookup) throws ResolverException {
        TypeExpressionParser parser = new TypeExpressionParser(source, namedLookup);
        Type t = parser.type();
        if (!parser.atEnd()) {
            throw parser.error("unexpected '" + parser.peek() + "'");
        }
        return t;
    }

    private Type type() throws ResolverException {
        String tok = next();
        switch (tok) {
            case "*":
                return new PointerType(type());
            case "(": {
                Type inner = type();
                expect(")");
                return inner;
            }
            case "[": {
                if (accept("]")) {
                    return new SliceType(type());
                }
                String len = next();
                long length;
                try {
                    length = Long.parseLong(len);
                } catch (NumberFormatException e) {
                    throw error("array length expected, found '" + len + "'");
                }
                expect("]");
                return new ArrayType(length, type());
            }
            case "map": {
                expect("[");
                Type key = type();
                expect("]");
                return new MapType(key, type());
            }
            case "chan":
                if (accept("<-")) {
                    return new ChanType(ChanType.Direction.SEND_ONLY, type());
                }
                return new ChanType(ChanType.Direction.SEND_RECV, type());
            case "<-":
                expect("chan");
                return new ChanType(ChanType.Direction.RECV_ONLY, type());
            case "func":
                return signature();
            case "struct":
                return structType();
            case "interface":
                return interfaceType();
            default:
                if (!isIdentifier(tok)) {
                    throw error("type expected, found '" + tok + "'");
                }
                return typeName(tok);
        }
    }

    private Type typeName(String first) throws ResolverException {
        if (accept(".")) {
            String member = next();
            if (!isIdentifier(member)) {
                throw error("identifier expected after '.'");
            }
            return lookupName(first + "." + member);
        }
        return lookupName(first);
    }

    private Type lookupName(String name) {
        var pre = Types.predeclared(name);
        if (pre.isPresent()) {
            return pre.get();
        }
        Type t = namedLookup.apply(name);
        return t == null ? WildcardType.INSTANCE : t;
    }

    private SignatureType signature() throws ResolverException {
        expect("(");
        ParamList params = paramList();
        List<Var> results = new ArrayList<>();
        if (accept("(")) {
            results.addAll(paramList().vars);
        } else if (!atEnd() && startsType(peek())) {
            results.add(new Var("", type()));
        }
        return new SignatureType(null, params.vars, results, params.variadic);
    }

    private record ParamList(List<Var> vars, boolean variadic) {}

    /**
     * Parses a parameter list after its opening parenthesis, consuming the closing one.
     * Supports unnamed ({@code int, string}), named ({@code a int}) and grouped
     * ({@code a, b int}) forms.
     */
    private ParamList paramList() throws ResolverException {
        List<String> names = new ArrayList<>();
        List<Type> types = new ArrayList<>();
        List<Boolean> bare = new ArrayList<>();
        boolean variadic = false;
        boolean named = false;
        while (!accept(")")) {
            String tok = peek();
            if (accept("...")) {
                variadic = true;
                names.add("");
                types.add(new SliceType(type()));
                bare.add(false);
            } else if (isIdentifier(tok) && !isKeyword(tok) && !".".equals(peekAt(1))) {
                next();
                if (peekIs(",") || peekIs(")")) {
                    // a type name or the first of grouped names, decided below
                    names.add(tok);
                    types.add(null);
                    bare.add(true);
                } else {
                    named = true;
                    names.add(tok);
                    if (accept("...")) {
                        variadic = true;
                        types.add(new SliceType(type()));
                    } else {
                        types.add(type());
                    }
                    bare.add(false);
                }
            } else {
                names.add("");
                types.add(type());
                bare.add(false);
            }
            if (!accept(",")) {
                expect(")");
                break;
            }
        }
        List<Var> vars = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            if (!named) {
                vars.add(new Var("", bare.get(i) ? lookupName(names.get(i)) : types.get(i)));
                continue;
            }
            if (names.get(i).isEmpty()) {
                throw error("mixed named and unnamed parameters");
            }
            Type t = types.get(i);
            // grouped names share the type of the next named entry
            for (int j = i + 1; t == null && j < names.size(); j++) {
                t = types.get(j);
            }
            if (t == null) {
                throw error("missing type for parameter '" + names.get(i) + "'");
            }
            vars.add(new Var(names.get(i), t));
        }
        return new ParamList(vars, variadic);
    }

    private StructType structType() throws ResolverException {
        expect("{");
        List<StructType.Field> fields = new ArrayList<>();
        while (!accept("}")) {
            String first = next();
            if (first.equals("*") || peekIs(".") || peekIs(";") || peekIs("}")) {
                // embedded field, named after its type
                boolean ptr = first.equals("*");
                String typeTok = ptr ? next() : first;
                Type t = typeName(typeTok);
                String fieldName = t instanceof NamedType n ? n.name() : typeTok;
                fields.add(new StructType.Field(fieldName, ptr ? new PointerType(t) : t, true));
            } else {
                List<String> group = new ArrayList<>();
                group.add(first);
                while (accept(",")) {
                    group.add(next());
                }
                Type t = type();
                for (String name : group) {
                    fields.add(new StructType.Field(name, t, false));
                }
            }
            accept(";");
        }
        return new StructType(fields);
    }

    private InterfaceType interfaceType() throws ResolverException {
        expect("{");
        List<InterfaceType.Method> methods = new ArrayList<>();
        while (!accept("}")) {
            String name = next();
            if (!isIdentifier(name)) {
                throw error("method name expected, found '" + name + "'");
            }
            methods.add(new InterfaceType.Method(name, signature()));
            accept(";");
        }
        return new InterfaceType(methods);
    }

    private boolean startsType(String tok) {
        return switch (tok) {
            case "*", "[", "(", "map", "chan", "<-", "func", "struct", "interface" -> true;
            default -> isIdentifier(tok);
        };
    }

    private static boolean isKeyword(String tok) {
        return switch (tok) {
            case "map", "chan", "func", "struct", "interface" -> true;
            default -> false;
        };
    }

    private static boolean isIdentifier(String tok) {
        if (tok == null || tok.isEmpty() || !(Character.isLetter(tok.charAt(0)) || tok.charAt(0) == '_')) {
            return false;
        }
        for (int i = 1; i < tok.length(); i++) {
            char c = tok.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }

    private boolean atEnd() {
        return pos >= tokens.size();
    }

    private String peek() {
        return atEnd() ? null : tokens.get(pos);
    }

    private String peekAt(int offset) {
        int i = pos + offset;
        return i < tokens.size() ? tokens.get(i) : null;
    }

    private boolean peekIs(String tok) {
        return tok.equals(peek());
    }

    private String next() throws ResolverException {
        if (atEnd()) {
            throw error("unexpected end of type expression");
        }
        return tokens.get(pos++);
    }

    private boolean accept(String tok) {
        if (peekIs(tok)) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(String tok) throws ResolverException {
        if (!accept(tok)) {
            throw error("'" + tok + "' expected, found '" + peek() + "'");
        }
    }

    private ResolverException error(String message) {
        return new ResolverException("Malformed type expression '" + source + "': " + message);
    }

    private static List<String> tokenize(String s) throws ResolverException {
        List<String> out = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) {
                    i++;
                }
                out.add(s.substring(start, i));
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < s.length() && Character.isDigit(s.charAt(i))) {
                    i++;
                }
                out.add(s.substring(start, i));
            } else if (s.startsWith("...", i)) {
                out.add("...");
                i += 3;
            } else if (s.startsWith("<-", i)) {
                out.add("<-");
                i += 2;
            } else if ("*[](){},;.".indexOf(c) >= 0) {
                out.add(String.valueOf(c));
                i++;
            } else {
                throw new ResolverException("Malformed type expression '" + s + "': unexpected character '" + c + "'");
            }
        }
        return out;
    }
}
