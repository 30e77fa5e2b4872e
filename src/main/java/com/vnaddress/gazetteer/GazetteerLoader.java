package com.vnaddress.gazetteer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a {@link Gazetteer} from JSON:
 *
 * <pre>
 * {
 *   "provinces": [ {"id": "79", "name": "Ho Chi Minh", "words": ["Ho Chi Minh"]} ],
 *   "districts": [ {"id": "760", "name": "Quan 1", "province": "79", "words": ["Q1"]} ],
 *   "wards":     [ {"id": "26734", "name": "Ben Nghe", "district": "760", "words": ["Ben Nghe"]} ]
 * }
 * </pre>
 *
 * Array order becomes the gazetteer's declaration order.
 */
public class GazetteerLoader {

    private static final Logger logger = LoggerFactory.getLogger(GazetteerLoader.class);

    private final ObjectMapper objectMapper;

    public GazetteerLoader() {
        this(new ObjectMapper());
    }

    public GazetteerLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Gazetteer loadFromClasspath(String resourcePath) {
        try (InputStream is = GazetteerLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new GazetteerException("Gazetteer resource not found: " + resourcePath);
            }
            return load(is, resourcePath);
        } catch (IOException e) {
            throw new GazetteerException("Failed to load gazetteer from " + resourcePath, e);
        }
    }

    public Gazetteer loadFromPath(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is, path.toString());
        } catch (IOException e) {
            throw new GazetteerException("Failed to load gazetteer from " + path, e);
        }
    }

    private Gazetteer load(InputStream is, String source) throws IOException {
        JsonNode rootNode = objectMapper.readTree(is);
        if (rootNode == null || !rootNode.isObject()) {
            throw new GazetteerException("Gazetteer document in " + source + " must be a JSON object");
        }

        Gazetteer.Builder builder = Gazetteer.builder();
        for (JsonNode node : arrayOf(rootNode, "provinces", source)) {
            builder.province(required(node, "id", source), required(node, "name", source), words(node, source));
        }
        for (JsonNode node : arrayOf(rootNode, "districts", source)) {
            builder.district(required(node, "id", source), required(node, "name", source),
                    required(node, "province", source), words(node, source));
        }
        for (JsonNode node : arrayOf(rootNode, "wards", source)) {
            builder.ward(required(node, "id", source), required(node, "name", source),
                    required(node, "district", source), words(node, source));
        }

        Gazetteer gazetteer = builder.build();
        logger.info("Loaded gazetteer from {}: {}", source, gazetteer.getStatistics());
        return gazetteer;
    }

    private static JsonNode arrayOf(JsonNode rootNode, String field, String source) {
        JsonNode node = rootNode.get(field);
        if (node == null || node.isNull()) {
            logger.warn("No '{}' section in gazetteer {}", field, source);
            return JsonNodeFactory.instance.arrayNode();
        }
        if (!node.isArray()) {
            throw new GazetteerException("'" + field + "' in " + source + " must be an array");
        }
        return node;
    }

    private static String required(JsonNode node, String field, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new GazetteerException("Missing '" + field + "' in " + source + ": " + node);
        }
        return value.asText().trim();
    }

    private static List<String> words(JsonNode node, String source) {
        JsonNode wordsNode = node.get("words");
        if (wordsNode == null || wordsNode.isNull()) {
            return List.of();
        }
        if (!wordsNode.isArray()) {
            throw new GazetteerException("'words' in " + source + " must be an array: " + node);
        }
        List<String> words = new ArrayList<>();
        for (JsonNode word : wordsNode) {
            if (!word.isTextual()) {
                throw new GazetteerException("Alias words in " + source + " must be strings: " + node);
            }
            words.add(word.asText());
        }
        return words;
    }
}
