package dev.tmgrammar.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered rule name to rule body mapping. Replacing an existing rule keeps its position.
 */
public final class Grammar {
    private final Map<String, String> rules;

    public Grammar() {
        this.rules = new LinkedHashMap<>();
    }

    private Grammar(Map<String, String> rules) {
        this.rules = new LinkedHashMap<>(rules);
    }

    public static Grammar copyOf(Map<String, String> rules) {
        return new Grammar(rules);
    }

    public Grammar copy() {
        return new Grammar(rules);
    }

    public void put(String name, String body) {
        rules.put(name, body);
    }

    public String get(String name) {
        return rules.get(name);
    }

    public boolean contains(String name) {
        return rules.containsKey(name);
    }

    /**
     * Prepend text to an existing rule body.
     */
    public void prepend(String name, String text) {
        String body = rules.get(name);
        if (body == null) {
            throw new IllegalArgumentException("No rule named '" + name + "'");
        }
        rules.put(name, text + body);
    }

    public List<String> names() {
        return new ArrayList<>(rules.keySet());
    }

    public int size() {
        return rules.size();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(rules);
    }

    @Override
    public String toString() {
        return "Grammar" + rules;
    }
}
