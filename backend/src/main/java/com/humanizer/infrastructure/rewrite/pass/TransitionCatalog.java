package com.humanizer.infrastructure.rewrite.pass;

import com.humanizer.domain.rewrite.model.SentenceRelationship;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Transition phrases per transition style, split into addition, contrast and cause categories.
 * Phrases are stored without their trailing comma.
 */
@Component
public class TransitionCatalog {

    private record TransitionTable(List<String> addition, List<String> contrast, List<String> cause) {}

    private final Map<String, TransitionTable> tables = new LinkedHashMap<>();

    public TransitionCatalog() {
        register("academic", new TransitionTable(
                List.of("Moreover", "Additionally", "Furthermore", "In addition", "Likewise"),
                List.of("Nonetheless", "Nevertheless", "In contrast", "On the other hand", "Conversely"),
                List.of("Hence", "Therefore", "Consequently", "As a result", "Accordingly")
        ));
        register("formal", new TransitionTable(
                List.of("Furthermore", "In addition", "Additionally", "Also"),
                List.of("However", "Nevertheless", "On the other hand"),
                List.of("Therefore", "Consequently", "Thus", "As a result")
        ));
        register("casual", new TransitionTable(
                List.of("Also", "Plus", "On top of that", "Besides"),
                List.of("But", "Still", "Even so", "Then again"),
                List.of("So", "Because of that", "As a result")
        ));
        register("technical", new TransitionTable(
                List.of("Additionally", "Also", "In addition"),
                List.of("However", "Alternatively", "By contrast"),
                List.of("Therefore", "As a result", "Consequently", "Thus")
        ));
        register("creative", new TransitionTable(
                List.of("What's more", "Beyond that", "Better yet", "Along the same lines"),
                List.of("Yet", "Even so", "Still", "Then again"),
                List.of("As such", "Naturally", "Because of this")
        ));
        register("balanced", new TransitionTable(
                List.of("Also", "In addition", "Additionally", "Moreover"),
                List.of("However", "Still", "On the other hand"),
                List.of("So", "Therefore", "As a result")
        ));
    }

    private void register(String style, TransitionTable table) {
        tables.put(style, table);
    }

    public boolean hasStyle(String style) {
        return style != null && tables.containsKey(style);
    }

    public Set<String> styles() {
        return tables.keySet();
    }

    /**
     * Candidate phrases for a style and category. UNSAFE and NONE use the addition list.
     *
     * @throws IllegalArgumentException for an unknown style
     */
    public List<String> phrases(String style, SentenceRelationship category) {
        TransitionTable table = tables.get(style);
        if (table == null) {
            throw new IllegalArgumentException("Unknown transition style: " + style);
        }
        return switch (category) {
            case CONTRAST -> table.contrast();
            case CAUSE -> table.cause();
            case ADDITION, UNSAFE, NONE -> table.addition();
        };
    }

    /**
     * Every phrase of every style, used to recognise sentences that already open with a transition.
     */
    public Collection<String> allPhrases() {
        Set<String> all = new LinkedHashSet<>();
        for (TransitionTable table : tables.values()) {
            all.addAll(table.addition());
            all.addAll(table.contrast());
            all.addAll(table.cause());
        }
        return all;
    }
}
