package ai.typerender.naming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Hands out styled names that are unique within one scope. A clash with a
 * forbidden word or an earlier name is settled with a numeric suffix that
 * goes through the same style.
 */
public class Namer {

    private static final Logger log = LoggerFactory.getLogger(Namer.class);

    private final String scope;
    private final WordCombiner style;
    private final Set<String> taken = new HashSet<>();

    public Namer(String scope, WordCombiner style, Collection<String> forbidden) {
        this.scope = scope;
        this.style = style;
        this.taken.addAll(forbidden);
    }

    public String assign(String label) {
        String styled = style.style(label);
        String candidate = styled;
        for (int suffix = 1; taken.contains(candidate); suffix++) {
            candidate = style.style(label + "_" + suffix);
        }
        if (!candidate.equals(styled)) {
            log.debug("Renamed '{}' to {} in {} scope", label, candidate, scope);
        }
        taken.add(candidate);
        return candidate;
    }
}
