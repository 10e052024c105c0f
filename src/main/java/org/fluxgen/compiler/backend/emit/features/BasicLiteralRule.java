package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.graph.nodes.BasicLiteralNode;

/**
 * Writes {@code const r = value}. String values are quoted with escapes, character
 * values are written as a rune literal of their first code point and numbers verbatim.
 */
public class BasicLiteralRule implements INodeEmissionRule<BasicLiteralNode> {

    @Override
    public Class<BasicLiteralNode> nodeType() {
        return BasicLiteralNode.class;
    }

    @Override
    public void emit(BasicLiteralNode node, EmissionContext ctx) {
        if (!ctx.hasConnectedOutput(node)) {
            return;
        }
        String value;
        switch (node.literalKind()) {
            case STRING -> value = quote(node.text(), '"');
            case CHAR -> {
                if (node.text().isEmpty()) {
                    ctx.omit(node, "empty character literal");
                    return;
                }
                value = quote(new String(Character.toChars(node.text().codePointAt(0))), '\'');
            }
            default -> {
                if (node.text().isBlank()) {
                    ctx.omit(node, "empty numeric literal");
                    return;
                }
                value = node.text();
            }
        }
        EmissionContext.Results results = ctx.results(node);
        ctx.indent("const " + results.first() + " = " + value);
        ctx.endStatement(node);
        ctx.assignExisting(results);
    }

    /**
     * Quotes text the way the target language's standard library does.
     *
     * @param text  The raw value.
     * @param quote {@code "} for strings, {@code '} for runes.
     * @return The quoted literal.
     */
    static String quote(String text, char quote) {
        StringBuilder sb = new StringBuilder().append(quote);
        text.codePoints().forEach(cp -> {
            switch (cp) {
                case 0x07 -> sb.append("\\a");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case 0x0B -> sb.append("\\v");
                case '\\' -> sb.append("\\\\");
                default -> {
                    if (cp == quote) {
                        sb.append('\\').append(quote);
                    } else if (isPrintable(cp)) {
                        sb.appendCodePoint(cp);
                    } else if (cp < 0x80) {
                        sb.append(String.format("\\x%02x", cp));
                    } else if (cp < 0x10000) {
                        sb.append(String.format("\\u%04x", cp));
                    } else {
                        sb.append(String.format("\\U%08x", cp));
                    }
                }
            }
        });
        return sb.append(quote).toString();
    }

    private static boolean isPrintable(int cp) {
        if (cp == ' ') {
            return true;
        }
        if (Character.isISOControl(cp)) {
            return false;
        }
        return switch (Character.getType(cp)) {
            case Character.UNASSIGNED, Character.FORMAT, Character.SURROGATE, Character.PRIVATE_USE,
                    Character.LINE_SEPARATOR, Character.PARAGRAPH_SEPARATOR, Character.SPACE_SEPARATOR -> false;
            default -> true;
        };
    }
}
