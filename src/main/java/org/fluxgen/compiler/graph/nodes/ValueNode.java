package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.TypeDerivation;
import org.fluxgen.compiler.semantics.ConstSymbol;
import org.fluxgen.compiler.semantics.FieldSymbol;
import org.fluxgen.compiler.semantics.FuncSymbol;
import org.fluxgen.compiler.semantics.LocalVar;
import org.fluxgen.compiler.semantics.Symbol;
import org.fluxgen.compiler.semantics.TypeNameSymbol;
import org.fluxgen.compiler.semantics.VarSymbol;
import org.fluxgen.compiler.types.PointerType;
import org.fluxgen.compiler.types.StructType;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;
import org.fluxgen.compiler.types.WildcardType;

/**
 * Reads or writes a named value.
 * <ul>
 *   <li>variables, constants, locals and functions are referenced by name;</li>
 *   <li>fields and methods are selected from the value on the {@code x} input;</li>
 *   <li>without a symbol the node dereferences the pointer on {@code x}.</li>
 * </ul>
 * Reading a field through a pointer yields a pointer to the field and marks the output
 * addressable.
 */
public final class ValueNode extends Node {

    private final Symbol symbol;
    private final boolean set;
    private PortId operand;
    private PortId value;

    /**
     * @param symbol The referenced symbol, or {@code null} for a pointer dereference.
     * @param set    {@code true} to assign instead of read.
     */
    public ValueNode(Symbol symbol, boolean set) {
        if (symbol instanceof TypeNameSymbol) {
            throw new IllegalArgumentException("A type name is not a value: " + symbol.name());
        }
        if (set && (symbol instanceof ConstSymbol || symbol instanceof FuncSymbol)) {
            throw new IllegalArgumentException("Cannot assign to " + symbol.name());
        }
        this.symbol = symbol;
        this.set = set;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VALUE;
    }

    @Override
    protected void assemble(NodeContext ctx) {
        if (needsOperand()) {
            Type operandType = symbol instanceof FuncSymbol f ? f.signature().receiver().type() : WildcardType.INSTANCE;
            operand = ctx.input("x", operandType);
        }
        Type t = symbol == null ? WildcardType.INSTANCE : valueType(symbol);
        String name = symbol == null ? "" : symbol.name();
        value = set ? ctx.input(name, t) : ctx.output(name, t);
    }

    private boolean needsOperand() {
        return symbol == null || symbol instanceof FieldSymbol || (symbol instanceof FuncSymbol f && f.isMethod());
    }

    private static Type valueType(Symbol symbol) {
        if (symbol instanceof FuncSymbol f) {
            return f.signature().withoutReceiver();
        }
        return symbol.type();
    }

    @Override
    protected void deriveTypes(TypeDerivation d) {
        if (operand == null || symbol instanceof FuncSymbol) {
            return;
        }
        Type source = d.sourceType(operand);
        d.setType(operand, source);
        if (symbol == null) {
            Type elem = Types.underlying(source) instanceof PointerType p ? p.elem() : WildcardType.INSTANCE;
            d.setType(value, elem);
            return;
        }
        Types.Indirection ind = Types.indirect(Types.underlying(source));
        Type fieldType = symbol.type();
        if (Types.isWildcard(fieldType) && Types.underlying(ind.base()) instanceof StructType s) {
            fieldType = s.field(symbol.name()).map(StructType.Field::type).orElse(WildcardType.INSTANCE);
        }
        boolean addressable = !set && ind.pointer();
        d.setType(value, addressable ? new PointerType(fieldType) : fieldType);
        if (!set) {
            d.setAddressable(value, addressable);
        }
    }

    /**
     * @return The symbol, or {@code null} for a dereference.
     */
    public Symbol symbol() {
        return symbol;
    }

    public boolean isSet() {
        return set;
    }

    public boolean isDereference() {
        return symbol == null;
    }

    public boolean isConstant() {
        return symbol instanceof ConstSymbol;
    }

    public boolean isPlainName() {
        return symbol instanceof VarSymbol || symbol instanceof ConstSymbol || symbol instanceof LocalVar
                || (symbol instanceof FuncSymbol f && !f.isMethod());
    }

    /**
     * @return The record, receiver or pointer input, or {@code null} for plain names.
     */
    public PortId operand() {
        return operand;
    }

    /**
     * @return The read output, or the assigned input for writes.
     */
    public PortId value() {
        return value;
    }
}
