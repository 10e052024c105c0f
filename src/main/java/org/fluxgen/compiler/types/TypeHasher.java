package org.fluxgen.compiler.types;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Computes hashes consistent with structural identity and caches them per type instance.
 * <p>
 * The cache grows with every type seen and never shrinks. Lookups update the cache, so a
 * hasher shared between threads needs a full lock around every call.
 */
public final class TypeHasher {

    private final Map<Type, Integer> memo = new IdentityHashMap<>();

    /**
     * @param type The type to hash.
     * @return The hash value.
     */
    public int hash(Type type) {
        Integer cached = memo.get(type);
        if (cached != null) {
            return cached;
        }
        int h = hashFor(type);
        memo.put(type, h);
        return h;
    }

    /**
     * @return The number of cached entries.
     */
    public int size() {
        return memo.size();
    }

    private int hashFor(Type t) {
        if (t == null || t instanceof WildcardType) {
            return 0x9e3779b9;
        }
        if (t instanceof BasicType b) {
            return TypeIdentity.canonicalBasicName(b.name()).hashCode();
        }
        if (t instanceof NamedType n) {
            // named types are identical by declaration, never by structure
            return 9157 * n.qualifiedName().hashCode();
        }
        if (t instanceof PointerType p) {
            return 9067 + 2 * hash(p.elem());
        }
        if (t instanceof ArrayType a) {
            return 9043 + 2 * (Long.hashCode(a.length()) + 3 * hash(a.elem()));
        }
        if (t instanceof SliceType s) {
            return 9049 + 2 * hash(s.elem());
        }
        if (t instanceof MapType m) {
            return 9109 + 2 * hash(m.key()) + 3 * hash(m.elem());
        }
        if (t instanceof ChanType c) {
            return 9127 + 2 * c.direction().ordinal() + 3 * hash(c.elem());
        }
        if (t instanceof SignatureType s) {
            return hashSignature(s);
        }
        if (t instanceof InterfaceType i) {
            int h = 9103;
            // method order does not affect identity, so combine commutatively
            for (InterfaceType.Method m : i.methods()) {
                h += 3 * m.name().hashCode() + 5 * hashSignature(m.signature());
            }
            return h;
        }
        StructType st = (StructType) t;
        int h = 9059;
        for (StructType.Field f : st.fields()) {
            h = 31 * h + f.name().hashCode();
            h = 31 * h + hash(f.type());
            if (f.embedded()) {
                h += 7;
            }
        }
        return h;
    }

    private int hashSignature(SignatureType s) {
        int h = 9091;
        if (s.variadic()) {
            h *= 8863;
        }
        for (Var p : s.params()) {
            h = 31 * h + hash(p.type());
        }
        h = 17 * h;
        for (Var r : s.results()) {
            h = 31 * h + hash(r.type());
        }
        return h;
    }
}
