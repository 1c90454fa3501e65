package com.example.tutor.ragservice.service;

import com.example.tutor.ragservice.model.Document;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Stream;

/**
 * Reads plain-text documents from disk: {@code .txt} and {@code .md} as one document each,
 * {@code .json} as one document per array item (or one for an object).
 */
@Component
@RequiredArgsConstructor
public class DocumentLoader {

    private static final Map<String, String> TYPES = Map.of(
            ".txt", "text",
            ".md", "markdown",
            ".json", "json");

    private final ObjectMapper om;
    private final Clock clock;

    public List<Path> listSupported(Path directory, boolean recursive) throws IOException {
        try (Stream<Path> files = recursive ? Files.walk(directory) : Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> TYPES.containsKey(extension(p)))
                    .sorted()
                    .toList();
        }
    }

    public List<Document> load(Path file) throws IOException {
        String ext = extension(file);
        String type = TYPES.get(ext);
        if (type == null) {
            throw new IllegalArgumentException("Unsupported file type: " + ext);
        }
        String filename = file.getFileName().toString();
        Map<String, Object> base = new LinkedHashMap<>();
        base.put("type", type);
        base.put("filename", filename);
        base.put("ingested_at", Instant.now(clock).toString());

        if (!".json".equals(ext)) {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return List.of(new Document(null, content, filename, base));
        }
        return loadJson(om.readTree(file.toFile()), filename, base);
    }

    private List<Document> loadJson(JsonNode root, String filename, Map<String, Object> base) throws IOException {
        List<Document> docs = new ArrayList<>();
        if (root.isArray()) {
            int i = 0;
            for (JsonNode item : root) {
                Map<String, Object> metadata = new LinkedHashMap<>(base);
                if (item.path("metadata").isObject()) {
                    metadata.putAll(om.convertValue(item.get("metadata"), Map.class));
                }
                metadata.put("json_index", i);
                docs.add(new Document(null, itemContent(item), filename + "_" + i, metadata));
                i++;
            }
        } else if (root.isObject()) {
            List<String> lines = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                JsonNode v = e.getValue();
                if (v.isValueNode()) {
                    lines.add(e.getKey() + ": " + v.asText());
                } else if (v.isObject()) {
                    lines.add(e.getKey() + ": " + om.writeValueAsString(v));
                }
            }
            docs.add(new Document(null, String.join("\n", lines), filename, base));
        }
        return docs;
    }

    private static String itemContent(JsonNode item) {
        if (item.path("content").isTextual()) {
            return item.get("content").asText();
        }
        if (!item.isContainerNode()) {
            return item.asText();
        }
        List<String> texts = new ArrayList<>();
        flattenJson(item, texts);
        return String.join("\n", texts);
    }

    private static void flattenJson(JsonNode node, List<String> out) {
        if (node.isTextual()) {
            String s = node.asText().trim();
            if (!s.isEmpty()) out.add(s);
        } else if (node.isNumber()) {
            out.add(node.asText());
        } else if (node.isContainerNode()) {
            node.elements().forEachRemaining(child -> flattenJson(child, out));
        } // booleans ignored
    }

    private static String extension(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot);
    }
}
