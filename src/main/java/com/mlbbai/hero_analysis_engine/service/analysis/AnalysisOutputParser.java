package com.mlbbai.hero_analysis_engine.service.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlbbai.hero_analysis_engine.model.HeroAnalysis;
import com.mlbbai.hero_analysis_engine.model.SynergyReport;
import com.mlbbai.hero_analysis_engine.util.ValidationUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns raw model output into validated reports.
 *
 * <p>Sanitation removes Markdown code fences and any prose outside the outermost
 * JSON object. Missing text fields and lists are filled from the fallback report
 * for the same subject; an output with no usable field at all is rejected.</p>
 */
public class AnalysisOutputParser {

    private final ObjectMapper objectMapper;

    public AnalysisOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Extracts the JSON object text from model output, e.g.
     * {@code "Sure!\n```json\n{...}\n```"} becomes {@code "{...}"}.
     */
    public static String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        String cleaned = raw.trim();
        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            cleaned = firstNewline < 0 ? "" : cleaned.substring(firstNewline + 1);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return cleaned.trim();
        }
        return cleaned.substring(start, end + 1);
    }

    public HeroAnalysis parseHeroAnalysis(String raw, HeroAnalysis defaults) {
        JsonNode root = readObject(raw);
        HeroAnalysis parsed = new HeroAnalysis(
            text(root, "overview", defaults.overview()),
            text(root, "playstyle", defaults.playstyle()),
            list(root, "strengths", defaults.strengths()),
            list(root, "weaknesses", defaults.weaknesses()),
            text(root, "earlyGame", defaults.earlyGame()),
            text(root, "lateGame", defaults.lateGame()),
            list(root, "tips", defaults.tips()),
            text(root, "metaRating", defaults.metaRating()),
            difficulty(root.path("difficulty").asText(""))
        );
        if (!root.hasNonNull("overview") && !root.hasNonNull("playstyle")) {
            throw new GenerativeBackendException("Model output has no analysis fields");
        }
        return parsed;
    }

    public SynergyReport parseSynergyReport(String raw, SynergyReport defaults) {
        JsonNode root = readObject(raw);
        JsonNode score = root.get("synergyScore");
        if (score == null || !hasNumber(score)) {
            throw new GenerativeBackendException("Model output has no synergyScore");
        }
        return new SynergyReport(
            (int) Math.round(score.asDouble()),
            text(root, "verdict", defaults.verdict()),
            text(root, "comboPotential", defaults.comboPotential()),
            text(root, "laneRecommendation", defaults.laneRecommendation()),
            list(root, "strengths", defaults.strengths()),
            list(root, "weaknesses", defaults.weaknesses()),
            text(root, "counterStrategy", defaults.counterStrategy()),
            text(root, "tip", defaults.tip())
        );
    }

    /**
     * Maps free-form difficulty onto Easy, Medium, Hard or Expert; anything else becomes Medium.
     */
    static String difficulty(String value) {
        String normalized = ValidationUtils.normalizeKey(value);
        for (String allowed : HeroAnalysis.DIFFICULTIES) {
            if (allowed.toLowerCase(Locale.ROOT).equals(normalized)) {
                return allowed;
            }
        }
        return HeroAnalysis.DEFAULT_DIFFICULTY;
    }

    private JsonNode readObject(String raw) {
        String json = sanitize(raw);
        if (json.isEmpty()) {
            throw new GenerativeBackendException("Model output is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new GenerativeBackendException("Model output is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new GenerativeBackendException("Model output is not a JSON object");
        }
        return root;
    }

    private static boolean hasNumber(JsonNode node) {
        if (node.isNumber()) {
            return true;
        }
        try {
            Double.parseDouble(node.asText().trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String text(JsonNode root, String field, String fallback) {
        JsonNode value = root.get(field);
        if (value == null || value.isNull() || value.isContainerNode() || !ValidationUtils.hasText(value.asText())) {
            return fallback;
        }
        return value.asText().trim();
    }

    private static List<String> list(JsonNode root, String field, List<String> fallback) {
        JsonNode value = root.get(field);
        if (value == null || !value.isArray()) {
            return fallback;
        }
        List<String> items = new ArrayList<>();
        value.forEach(item -> {
            if (item.isValueNode() && ValidationUtils.hasText(item.asText())) {
                items.add(item.asText().trim());
            }
        });
        return items.isEmpty() ? fallback : items;
    }
}
