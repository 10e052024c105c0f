package org.fluxgen.compiler.backend.emit;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Hands out collision-free identifiers for one emission session.
 * <p>
 * Every name passed to the constructor is reserved up front. A taken candidate gets the
 * next counter of its base appended, and the result is checked again, so a generated name
 * can never equal a reserved or previously generated one.
 */
public final class NameAllocator {

    private final Map<String, Integer> counters = new HashMap<>();
    private final String defaultBase;

    /**
     * @param reserved    Names already visible in the defining scope.
     * @param defaultBase Replacement for empty and {@code "_"} candidates.
     */
    public NameAllocator(Collection<String> reserved, String defaultBase) {
        this.defaultBase = defaultBase;
        for (String r : reserved) {
            name(r);
        }
    }

    /**
     * @param candidate The preferred name, possibly empty.
     * @return A name unique within this session.
     */
    public String name(String candidate) {
        String s = candidate == null || candidate.isEmpty() || candidate.equals("_") ? defaultBase : candidate;
        Integer next = counters.get(s);
        while (next != null) {
            counters.put(s, next + 1);
            s = s + next;
            next = counters.get(s);
        }
        counters.put(s, 2);
        return s;
    }

    /**
     * @return {@code true} if the name is reserved or was handed out.
     */
    public boolean isTaken(String name) {
        return counters.containsKey(name);
    }
}
