package com.mlbbai.hero_analysis_engine.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Null-safe probing helpers for provider JSON whose field names drift between releases.
 * None of these methods throw on unexpected shapes; absent or unusable values
 * come back as empty results.
 */
public final class HeroJsonFields {

    private HeroJsonFields() {
    }

    /**
     * Returns the first candidate field holding non-blank text (numbers are rendered as text).
     */
    public static Optional<String> firstText(JsonNode node, String... fieldNames) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String field : fieldNames) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull() || value.isContainerNode()) {
                continue;
            }
            String text = value.asText();
            if (ValidationUtils.hasText(text)) {
                return Optional.of(text.trim());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the first candidate field that parses as a rate, normalised to a fraction.
     * Accepts fractions (0.523), percentages (52.3) and percent strings ("52.3%").
     */
    public static Optional<Double> firstRate(JsonNode node, String... fieldNames) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String field : fieldNames) {
            Optional<Double> rate = parseRate(node.get(field));
            if (rate.isPresent()) {
                return rate;
            }
        }
        return Optional.empty();
    }

    public static Optional<Double> parseRate(JsonNode value) {
        if (value == null || value.isNull() || value.isContainerNode()) {
            return Optional.empty();
        }
        double parsed;
        boolean percentSuffix = false;
        if (value.isNumber()) {
            parsed = value.asDouble();
        } else {
            String text = value.asText().trim();
            if (text.endsWith("%")) {
                percentSuffix = true;
                text = text.substring(0, text.length() - 1).trim();
            }
            try {
                parsed = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (Double.isNaN(parsed) || Double.isInfinite(parsed) || parsed < 0) {
            return Optional.empty();
        }
        if (percentSuffix || parsed > 1.0) {
            parsed = parsed / 100.0;
        }
        return parsed > 1.0 ? Optional.empty() : Optional.of(parsed);
    }

    public static int intOrZero(JsonNode node, String fieldName) {
        if (node == null || !node.isObject()) {
            return 0;
        }
        JsonNode value = node.get(fieldName);
        if (value == null || value.isNull()) {
            return 0;
        }
        if (value.isNumber()) {
            return value.asInt();
        }
        return value.asInt(0);
    }

    /**
     * Descends through {@code data} wrappers, e.g. {@code {data: {data: {...}}}} -> innermost object.
     */
    public static JsonNode unwrapData(JsonNode node, int maxDepth) {
        JsonNode current = node;
        for (int i = 0; i < maxDepth && current != null && current.isObject(); i++) {
            JsonNode inner = current.get("data");
            if (inner == null || !inner.isObject()) {
                break;
            }
            current = inner;
        }
        return current;
    }

    /**
     * Locates the first array among the node itself and the named children,
     * trying each of the given paths in order.
     */
    public static List<JsonNode> firstArray(JsonNode node, String... paths) {
        if (node == null) {
            return List.of();
        }
        if (node.isArray()) {
            return toList(node);
        }
        for (String path : paths) {
            JsonNode candidate = node.at(path);
            if (candidate.isArray()) {
                return toList(candidate);
            }
        }
        return List.of();
    }

    /**
     * Maps an array of hero references (objects with a name, or bare strings) to names.
     */
    public static List<String> names(List<JsonNode> elements, String... nameFields) {
        List<String> names = new ArrayList<>();
        for (JsonNode element : elements) {
            if (element == null) {
                continue;
            }
            if (element.isTextual() && ValidationUtils.hasText(element.asText())) {
                names.add(element.asText().trim());
                continue;
            }
            JsonNode inner = unwrapData(element, 2);
            firstText(inner, nameFields).or(() -> firstText(element, nameFields)).ifPresent(names::add);
        }
        return List.copyOf(names);
    }

    private static List<JsonNode> toList(JsonNode array) {
        List<JsonNode> out = new ArrayList<>(array.size());
        array.forEach(out::add);
        return out;
    }
}
