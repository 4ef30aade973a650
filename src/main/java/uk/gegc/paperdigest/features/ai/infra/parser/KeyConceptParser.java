package uk.gegc.paperdigest.features.ai.infra.parser;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns "concept: explanation" lines into an ordered map. Lines without a colon are ignored; a concept
 * repeated later overwrites the earlier explanation.
 */
@Component
public class KeyConceptParser {

    public Map<String, String> parse(String rawOutput) {
        Map<String, String> concepts = new LinkedHashMap<>();
        if (rawOutput == null) {
            return concepts;
        }
        for (String line : rawOutput.split("\n")) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String concept = line.substring(0, colon).strip();
            if (concept.isEmpty()) {
                continue;
            }
            concepts.put(concept, line.substring(colon + 1).strip());
        }
        return concepts;
    }
}
