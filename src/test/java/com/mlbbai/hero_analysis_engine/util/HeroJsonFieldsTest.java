package com.mlbbai.hero_analysis_engine.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HeroJsonFieldsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void parseRateAcceptsFractionsPercentagesAndStrings() {
        assertThat(HeroJsonFields.parseRate(objectMapper.valueToTree(0.523))).contains(0.523);
        assertThat(HeroJsonFields.parseRate(objectMapper.valueToTree(52.3))).hasValueSatisfying(v ->
            assertThat(v).isCloseTo(0.523, org.assertj.core.data.Offset.offset(1e-9)));
        assertThat(HeroJsonFields.parseRate(new TextNode("52.3%"))).hasValueSatisfying(v ->
            assertThat(v).isCloseTo(0.523, org.assertj.core.data.Offset.offset(1e-9)));
        assertThat(HeroJsonFields.parseRate(new TextNode("0.4"))).contains(0.4);
    }

    @Test
    void parseRateRejectsUnusableValues() {
        assertThat(HeroJsonFields.parseRate(null)).isEmpty();
        assertThat(HeroJsonFields.parseRate(new TextNode("n/a"))).isEmpty();
        assertThat(HeroJsonFields.parseRate(objectMapper.valueToTree(-0.1))).isEmpty();
        assertThat(HeroJsonFields.parseRate(objectMapper.valueToTree(250))).isEmpty();
        assertThat(HeroJsonFields.parseRate(objectMapper.createObjectNode())).isEmpty();
    }

    @Test
    void firstTextSkipsBlankAndContainerFields() throws Exception {
        JsonNode node = objectMapper.readTree("{\"name\":\" \",\"hero_name\":{\"x\":1},\"title\":\"Layla\"}");

        assertThat(HeroJsonFields.firstText(node, "name", "hero_name", "title")).contains("Layla");
        assertThat(HeroJsonFields.firstText(node, "missing")).isEmpty();
        assertThat(HeroJsonFields.firstText(objectMapper.createArrayNode(), "name")).isEmpty();
    }

    @Test
    void unwrapDataDescendsNestedWrappers() throws Exception {
        JsonNode node = objectMapper.readTree("{\"data\":{\"data\":{\"name\":\"Miya\"}}}");

        assertThat(HeroJsonFields.unwrapData(node, 3).path("name").asText()).isEqualTo("Miya");
        assertThat(HeroJsonFields.unwrapData(node, 1).has("data")).isTrue();
    }

    @Test
    void firstArrayTriesPathsInOrder() throws Exception {
        JsonNode node = objectMapper.readTree("{\"data\":{\"records\":[1,2,3]}}");

        assertThat(HeroJsonFields.firstArray(node, "/data", "/data/records")).hasSize(3);
        assertThat(HeroJsonFields.firstArray(node, "/missing")).isEmpty();
        assertThat(HeroJsonFields.firstArray(null, "/data")).isEmpty();
    }

    @Test
    void namesReadsObjectsAndBareStrings() throws Exception {
        JsonNode array = objectMapper.readTree("[{\"name\":\"Tigreal\"},\"Angela\",{\"data\":{\"hero_name\":\"Estes\"}},{}]");
        List<JsonNode> elements = HeroJsonFields.firstArray(array);

        assertThat(HeroJsonFields.names(elements, "name", "hero_name")).containsExactly("Tigreal", "Angela", "Estes");
    }

    @Test
    void intOrZeroDefaultsMissingValues() throws Exception {
        JsonNode node = objectMapper.readTree("{\"offense\":7,\"control\":\"5\",\"mobility\":null}");

        assertThat(HeroJsonFields.intOrZero(node, "offense")).isEqualTo(7);
        assertThat(HeroJsonFields.intOrZero(node, "control")).isEqualTo(5);
        assertThat(HeroJsonFields.intOrZero(node, "mobility")).isZero();
        assertThat(HeroJsonFields.intOrZero(node, "support")).isZero();
    }
}
