package com.relationship.scoring.judgment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates raw judgment responses.
 *
 * <p>The response must be a JSON object with an integral {@code confidence_score} and an
 * {@code explanation_bullets} array of strings. If the text is not JSON as a whole, the
 * outermost {@code {...}} block inside it is tried. Scores outside 0-100 are clamped.
 * Any other deviation yields {@link JudgmentResult#error(String)}.</p>
 */
public class JudgmentResponseParser {
    private static final Logger log = LoggerFactory.getLogger(JudgmentResponseParser.class);

    static final String CONFIDENCE_FIELD = "confidence_score";
    static final String BULLETS_FIELD = "explanation_bullets";

    private static final Pattern EMBEDDED_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");

    private final ObjectMapper objectMapper;

    public JudgmentResponseParser() {
        this(new ObjectMapper());
    }

    public JudgmentResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JudgmentResult parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return JudgmentResult.error("Empty response from judgment service");
        }

        JsonNode root;
        try {
            root = readObject(raw);
        } catch (JsonProcessingException e) {
            log.warn("judgment.parse.failed reason={}", e.getOriginalMessage());
            return JudgmentResult.error("Invalid JSON in judgment response: " + e.getOriginalMessage());
        }
        if (root == null) {
            return JudgmentResult.error("No valid JSON found in judgment response");
        }

        JsonNode confidence = root.get(CONFIDENCE_FIELD);
        if (confidence == null || confidence.isNull()) {
            return JudgmentResult.error("Missing required field: " + CONFIDENCE_FIELD);
        }
        if (!confidence.isNumber() || !isIntegral(confidence)) {
            return JudgmentResult.error(CONFIDENCE_FIELD + " must be an integer");
        }

        JsonNode bullets = root.get(BULLETS_FIELD);
        if (bullets == null || bullets.isNull()) {
            return JudgmentResult.error("Missing required field: " + BULLETS_FIELD);
        }
        if (!bullets.isArray()) {
            return JudgmentResult.error(BULLETS_FIELD + " must be a list");
        }
        List<String> explanation = new ArrayList<>(bullets.size());
        for (JsonNode bullet : bullets) {
            if (!bullet.isTextual()) {
                return JudgmentResult.error(BULLETS_FIELD + " must contain only strings");
            }
            explanation.add(bullet.asText());
        }

        long score = confidence.asLong();
        int clamped = (int) Math.max(0, Math.min(100, score));
        if (clamped != score) {
            log.debug("Clamped judgment confidence {} to {}", score, clamped);
        }
        return JudgmentResult.of(clamped, explanation);
    }

    /**
     * Returns the JSON object in the text, or null if there is none.
     */
    private JsonNode readObject(String raw) throws JsonProcessingException {
        try {
            JsonNode whole = objectMapper.readTree(raw);
            if (whole != null && whole.isObject()) {
                return whole;
            }
        } catch (JsonProcessingException e) {
            log.debug("Judgment response is not plain JSON, looking for an embedded object");
        }

        Matcher matcher = EMBEDDED_OBJECT.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        JsonNode embedded = objectMapper.readTree(matcher.group());
        return embedded != null && embedded.isObject() ? embedded : null;
    }

    private static boolean isIntegral(JsonNode number) {
        if (number.isIntegralNumber()) {
            return true;
        }
        double value = number.asDouble();
        return !Double.isInfinite(value) && value == Math.rint(value);
    }
}
