package org.fluxgen.compiler.backend.emit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Trailing statement marker recording explicit ordering: {@code //p1,p2;id}.
 * <p>
 * {@code p1,p2} are the ids of the statements this one is ordered after and {@code id}
 * is the id later statements refer to. Either part may be empty.
 *
 * @param predecessors Ids of the preceding statements.
 * @param id           Own id, or -1 if nothing is ordered after this statement.
 */
public record SequenceAnnotation(List<Integer> predecessors, int id) {

    private static final Pattern TRAILER = Pattern.compile("//((?:\\d+(?:,\\d+)*)?);(\\d*)$");

    public SequenceAnnotation {
        predecessors = List.copyOf(predecessors);
    }

    /**
     * @return The marker text, starting with {@code //}.
     */
    public String format() {
        StringBuilder sb = new StringBuilder("//");
        for (int i = 0; i < predecessors.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(predecessors.get(i));
        }
        sb.append(';');
        if (id >= 0) {
            sb.append(id);
        }
        return sb.toString();
    }

    /**
     * Recovers the annotation from a generated line.
     *
     * @param line A line of generated text, with or without its line break.
     * @return The annotation, if the line ends with one.
     */
    public static Optional<SequenceAnnotation> parse(String line) {
        Matcher m = TRAILER.matcher(line.stripTrailing());
        if (!m.find()) {
            return Optional.empty();
        }
        List<Integer> preds = new ArrayList<>();
        if (!m.group(1).isEmpty()) {
            for (String p : m.group(1).split(",")) {
                preds.add(Integer.parseInt(p));
            }
        }
        int id = m.group(2).isEmpty() ? -1 : Integer.parseInt(m.group(2));
        return Optional.of(new SequenceAnnotation(preds, id));
    }
}
