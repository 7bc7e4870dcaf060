package io.github.drompincen.payverify.runtime.verification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the JSON object out of a model reply. Replies that cannot be parsed even
 * after repair are treated as an empty extraction so the comparison still runs
 * and reports missing data.
 */
@Component
public class RawExtractionParser {

    private static final Logger log = LoggerFactory.getLogger(RawExtractionParser.class);

    private static final List<Pattern> JSON_LOCATORS = List.of(
            Pattern.compile("```json\\s*(.*?)\\s*```", Pattern.DOTALL),
            Pattern.compile("```\\s*(.*?)\\s*```", Pattern.DOTALL),
            Pattern.compile("(\\{.*\\})", Pattern.DOTALL));

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public RawExtractionParser() {
        this(new ObjectMapper());
    }

    @Autowired
    public RawExtractionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws ExtractionException if the reply is well-formed JSON but not an object
     */
    public Map<String, Object> parse(String modelText) {
        if (modelText == null || modelText.isBlank()) {
            log.warn("Empty model reply, treating every field as unknown");
            return Map.of();
        }
        String json = locateJson(modelText.trim());

        JsonNode tree = readOrNull(json);
        if (tree == null) {
            tree = readOrNull(repair(json));
        }
        if (tree == null) {
            log.warn("Could not parse model reply as JSON, treating every field as unknown");
            return Map.of();
        }
        if (!tree.isObject()) {
            throw new ExtractionException("Invalid response format - not a JSON object");
        }
        return objectMapper.convertValue(tree, MAP_TYPE);
    }

    static String locateJson(String text) {
        for (Pattern pattern : JSON_LOCATORS) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                return m.group(1).trim();
            }
        }
        return text;
    }

    static String repair(String json) {
        return json.replace('\'', '"')
                .replace("True", "true")
                .replace("False", "false")
                .replace("None", "null");
    }

    private JsonNode readOrNull(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            log.debug("JSON parse failed: {}", e.getOriginalMessage());
            return null;
        }
    }
}
