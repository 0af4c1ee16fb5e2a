package com.framesmith.core.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.framesmith.core.model.ComponentDescriptor;
import com.framesmith.core.model.GeneratedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw oracle text into files and component descriptors.
 * <p>
 * Structured JSON is tried first: the whole text, then fenced ```json blocks, then the first balanced
 * object embedded in prose. Text that holds no usable JSON falls back to {@code File: path} headers
 * followed by fenced code blocks.
 */
@Component
public class OracleResponseParser {

    private static final Logger log = LoggerFactory.getLogger(OracleResponseParser.class);

    private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*(\\{.*?})\\s*```", Pattern.DOTALL);
    private static final Pattern FILE_BLOCK = Pattern.compile(
            "File:\\s*(?<path>[^\\n]+)\\n```[a-zA-Z0-9+-]*\\n(?<content>.*?)```", Pattern.DOTALL);
    private static final Pattern FILE_HEADER = Pattern.compile("File:\\s*(?<path>[^\\n]+)\\n```[a-zA-Z0-9+-]*\\n");

    private static final Set<String> STRUCTURED_KEYS = Set.of(
            "files", "backendFiles", "frontend", "backend", "registryEntry", "registryEntries", "registryRef");
    private static final Set<String> UI_EXTENSIONS = Set.of("tsx", "jsx", "css", "scss", "html", "vue", "svelte");
    private static final Set<String> API_EXTENSIONS = Set.of("ts", "js", "py", "java", "go");

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @throws OracleParseException when neither structured JSON nor file blocks can be found
     */
    public ParsedOracleResponse parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new OracleParseException("Oracle returned empty content");
        }
        String text = raw.replace("\r\n", "\n");
        OracleParseException structuredFailure = null;
        for (JsonNode candidate : structuredCandidates(text)) {
            try {
                return fromJson(candidate);
            } catch (OracleParseException e) {
                // a JSON block such as package.json inside a text reply
                log.debug("Structured candidate unusable: {}", e.getMessage());
                structuredFailure = e;
            }
        }
        log.info("No usable structured JSON in oracle response, trying file-block extraction");
        ParsedOracleResponse fallback = fromText(text);
        if (fallback.uiFiles().isEmpty() && fallback.apiFiles().isEmpty()) {
            if (structuredFailure != null) {
                throw structuredFailure;
            }
            throw new OracleParseException("Oracle response holds neither JSON nor file blocks ("
                    + raw.length() + " chars)");
        }
        return fallback;
    }

    private List<JsonNode> structuredCandidates(String raw) {
        var candidates = new ArrayList<String>();
        candidates.add(raw.trim());
        Matcher fenced = FENCED_JSON.matcher(raw);
        while (fenced.find()) {
            candidates.add(fenced.group(1));
        }
        String embedded = firstBalancedObject(raw);
        if (embedded != null) {
            candidates.add(embedded);
        }
        var structured = new ArrayList<JsonNode>();
        for (String candidate : new LinkedHashSet<>(candidates)) {
            if (!candidate.startsWith("{")) {
                continue;
            }
            try {
                JsonNode node = objectMapper.readTree(candidate);
                if (node != null && node.isObject() && hasStructuredKey(node)) {
                    structured.add(node);
                }
            } catch (Exception e) {
                log.debug("Candidate JSON block rejected: {}", e.getMessage());
            }
        }
        return structured;
    }

    private static boolean hasStructuredKey(JsonNode node) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            if (STRUCTURED_KEYS.contains(names.next())) {
                return true;
            }
        }
        return false;
    }

    /**
     * First {@code {...}} span with balanced braces, ignoring braces inside JSON strings.
     */
    static String firstBalancedObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (inString) {
                    if (escaped) {
                        escaped = false;
                    } else if (c == '\\') {
                        escaped = true;
                    } else if (c == '"') {
                        inString = false;
                    }
                    continue;
                }
                if (c == '"') {
                    inString = true;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return text.substring(start, i + 1);
                    }
                }
            }
            start = text.indexOf('{', start + 1);
        }
        return null;
    }

    private ParsedOracleResponse fromJson(JsonNode json) {
        if (json.hasNonNull("registryRef") && json.get("registryRef").isTextual()
                && !json.get("registryRef").asText().isBlank()) {
            return ParsedOracleResponse.registryRef(json.get("registryRef").asText().trim());
        }
        var ui = new ArrayList<GeneratedFile>();
        var api = new ArrayList<GeneratedFile>();
        readFileList(json.get("files"), ui);
        readFileList(json.get("backendFiles"), api);
        readFileMap(json.get("frontend"), ui);
        readFileMap(json.get("backend"), api);

        var components = new ArrayList<ComponentDescriptor>();
        readDescriptor(json.get("registryEntry")).ifPresent(components::add);
        JsonNode entries = json.get("registryEntries");
        if (entries != null && entries.isArray()) {
            for (JsonNode entry : entries) {
                readDescriptor(entry).ifPresent(components::add);
            }
        }
        if (ui.isEmpty() && api.isEmpty() && components.isEmpty()) {
            throw new OracleParseException("Structured oracle response holds no files and no component");
        }
        return new ParsedOracleResponse(ParsedOracleResponse.Shape.STRUCTURED, ui, api, components, null);
    }

    private void readFileList(JsonNode files, List<GeneratedFile> out) {
        if (files == null || !files.isArray()) {
            return;
        }
        for (JsonNode file : files) {
            if (file.hasNonNull("path") && file.hasNonNull("content")) {
                addSafely(file.get("path").asText(), file.get("content").asText(), out);
            }
        }
    }

    private void readFileMap(JsonNode files, List<GeneratedFile> out) {
        if (files == null || !files.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = files.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            addSafely(field.getKey(), field.getValue().asText(), out);
        }
    }

    private Optional<ComponentDescriptor> readDescriptor(JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            return Optional.empty();
        }
        String name = text(entry, "componentName");
        if (name == null) {
            name = text(entry, "name");
        }
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String path = text(entry, "path");
        if (path == null) {
            path = text(entry, "filePath");
        }
        return Optional.of(new ComponentDescriptor(name.trim(), name.trim(), path == null ? null : normalizePath(path),
                strings(entry.get("tokens")), new LinkedHashSet<>(strings(entry.get("variants"))),
                new LinkedHashSet<>(strings(entry.get("screensUsed"))),
                strings(entry.get("dependencies")), strings(entry.get("apiEndpoints")),
                instant(text(entry, "lastGenerated"))));
    }

    private ParsedOracleResponse fromText(String raw) {
        var ui = new ArrayList<GeneratedFile>();
        var api = new ArrayList<GeneratedFile>();
        Matcher matcher = FILE_BLOCK.matcher(raw);
        int end = 0;
        while (matcher.find()) {
            String path = matcher.group("path").trim();
            String content = matcher.group("content").strip() + "\n";
            addSafely(path, content, isApiPath(path) ? api : ui);
            end = matcher.end();
        }
        recoverUnclosedBlock(raw, end, ui, api);
        return new ParsedOracleResponse(ParsedOracleResponse.Shape.TEXT, ui, api, List.of(), null);
    }

    /**
     * Keeps a last block whose closing fence was cut off, as in a truncated reply.
     */
    private static void recoverUnclosedBlock(String raw, int from, List<GeneratedFile> ui, List<GeneratedFile> api) {
        int header = raw.lastIndexOf("File:");
        if (header < from) {
            return;
        }
        Matcher opening = FILE_HEADER.matcher(raw);
        opening.region(header, raw.length());
        if (!opening.lookingAt()) {
            return;
        }
        String content = raw.substring(opening.end());
        if (content.contains("```") || content.isBlank()) {
            return;
        }
        String path = opening.group("path").trim();
        log.warn("Recovering unterminated code block for {}", path);
        addSafely(path, content.strip() + "\n", isApiPath(path) ? api : ui);
    }

    /**
     * API side when the path names a backend directory or has a script extension; UI side otherwise.
     */
    static boolean isApiPath(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.startsWith("backend/") || lower.startsWith("server/") || lower.startsWith("api/")) {
            return true;
        }
        int dot = lower.lastIndexOf('.');
        String extension = dot < 0 ? "" : lower.substring(dot + 1);
        if (UI_EXTENSIONS.contains(extension)) {
            return false;
        }
        return API_EXTENSIONS.contains(extension);
    }

    private static void addSafely(String path, String content, List<GeneratedFile> out) {
        String normalized = normalizePath(path);
        if (normalized.isEmpty() || normalized.startsWith("../") || normalized.contains("/../")
                || normalized.equals("..")) {
            log.warn("Dropping generated file with unsafe path: {}", path);
            return;
        }
        out.add(new GeneratedFile(normalized, content));
    }

    static String normalizePath(String path) {
        String normalized = path.trim().replace('\\', '/');
        while (normalized.startsWith("/") || normalized.startsWith("./")) {
            normalized = normalized.startsWith("/") ? normalized.substring(1) : normalized.substring(2);
        }
        return normalized;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static List<String> strings(JsonNode node) {
        var values = new ArrayList<String>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isValueNode()) {
                    values.add(item.asText());
                } else if (item.hasNonNull("name")) {
                    values.add(item.get("name").asText());
                }
            }
        } else if (node.isObject()) {
            node.fieldNames().forEachRemaining(values::add);
        } else if (node.isValueNode()) {
            values.add(node.asText());
        }
        return values;
    }

    private static Instant instant(String value) {
        if (value == null) {
            return Instant.now();
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }
}
