package com.autofix.orchestrator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the structured answer an agent intended as its final result inside
 * its raw stream-json output.
 *
 * The agent may think out loud, emit draft JSON, correct itself or wrap the
 * answer in prose, so the search order matters:
 * <ol>
 *   <li>Collect the text of assistant events, in emission order.</li>
 *   <li>Scan those texts newest-first; inside each, scan its {@code ```json}
 *       fences last-to-first.</li>
 *   <li>Accept the first block that decodes to an object holding the
 *       required key (its value is not inspected).</li>
 *   <li>Otherwise unescape {@code \n}, {@code \"} and {@code \\} in the raw
 *       output and repeat the fence scan over the whole text.</li>
 *   <li>Otherwise try single-level {@code {...}} objects that mention the key,
 *       last-to-first.</li>
 * </ol>
 * Never throws on malformed input; returns empty when nothing qualifies.
 *
 * Pure functions only: no I/O, no process, no Spring context.
 */
public final class ResultExtractor {

    // ```json <body> ``` : the body is matched lazily up to the next fence, so
    // nested braces inside the body are irrelevant to the match.
    private static final Pattern JSON_FENCE = Pattern.compile(
            "```json[ \\t]*\\r?\\n?(.*?)```",
            Pattern.DOTALL
    );

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private ResultExtractor() {}

    /**
     * Extract the newest structured payload containing {@code requiredField}.
     */
    public static Optional<Map<String, Object>> extract(String rawOutput, String requiredField) {
        if (rawOutput == null || rawOutput.isEmpty() || requiredField == null) {
            return Optional.empty();
        }

        List<String> segments = assistantTextSegments(rawOutput);
        for (int i = segments.size() - 1; i >= 0; i--) {
            Optional<Map<String, Object>> found = scanFences(segments.get(i), requiredField);
            if (found.isPresent()) {
                return found;
            }
        }

        String unescaped = unescape(rawOutput);
        Optional<Map<String, Object>> fenced = scanFences(unescaped, requiredField);
        if (fenced.isPresent()) {
            return fenced;
        }

        return scanBareObjects(unescaped, requiredField);
    }

    /**
     * Try each field name in order and return the first payload found.
     * Agents drift between equivalent marker names (e.g. {@code fix_applied}
     * vs {@code files_changed}), so stages pass all the names they accept.
     */
    public static Optional<Map<String, Object>> extractAny(String rawOutput, List<String> requiredFields) {
        for (String field : requiredFields) {
            Optional<Map<String, Object>> found = extract(rawOutput, field);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    // ------------------------------------------------------------------
    // Event records
    // ------------------------------------------------------------------

    /**
     * Text content of every {@code {"type":"assistant"}} event, in order.
     * Lines that are not JSON, and events of other types, are ignored.
     */
    static List<String> assistantTextSegments(String rawOutput) {
        List<String> texts = new ArrayList<>();
        for (String line : rawOutput.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode event;
            try {
                event = JSON.readTree(line);
            } catch (JsonProcessingException e) {
                continue;
            }
            if (event == null || !"assistant".equals(event.path("type").asText())) {
                continue;
            }
            for (JsonNode content : event.path("message").path("content")) {
                if ("text".equals(content.path("type").asText())) {
                    texts.add(content.path("text").asText(""));
                }
            }
        }
        return texts;
    }

    // ------------------------------------------------------------------
    // Candidate scans
    // ------------------------------------------------------------------

    /** All ```json fence bodies in {@code text}, in order of appearance. */
    static List<String> fencedJsonBlocks(String text) {
        List<String> blocks = new ArrayList<>();
        Matcher m = JSON_FENCE.matcher(text);
        while (m.find()) {
            blocks.add(m.group(1).strip());
        }
        return blocks;
    }

    private static Optional<Map<String, Object>> scanFences(String text, String requiredField) {
        List<String> blocks = fencedJsonBlocks(text);
        for (int i = blocks.size() - 1; i >= 0; i--) {
            Optional<Map<String, Object>> decoded = decodeWithField(blocks.get(i), requiredField);
            if (decoded.isPresent()) {
                return decoded;
            }
        }
        return Optional.empty();
    }

    private static Optional<Map<String, Object>> scanBareObjects(String text, String requiredField) {
        Pattern bare = Pattern.compile("\\{[^{}]*\"" + Pattern.quote(requiredField) + "\"[^{}]*}");
        List<String> candidates = new ArrayList<>();
        Matcher m = bare.matcher(text);
        while (m.find()) {
            candidates.add(m.group());
        }
        for (int i = candidates.size() - 1; i >= 0; i--) {
            Optional<Map<String, Object>> decoded = decodeWithField(candidates.get(i), requiredField);
            if (decoded.isPresent()) {
                return decoded;
            }
        }
        return Optional.empty();
    }

    /** Decode {@code candidate} as a JSON object; keep it only if it has the key. */
    private static Optional<Map<String, Object>> decodeWithField(String candidate, String requiredField) {
        if (candidate.isEmpty() || candidate.charAt(0) != '{') {
            return Optional.empty();
        }
        try {
            JsonNode node = JSON.readTree(candidate);
            if (node == null || !node.isObject() || !node.has(requiredField)) {
                return Optional.empty();
            }
            return Optional.of(JSON.convertValue(node, MAP_TYPE));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** Undo the string escaping of JSON-encoded transcript text. */
    static String unescape(String raw) {
        return raw.replace("\\n", "\n")
                  .replace("\\\"", "\"")
                  .replace("\\\\", "\\");
    }
}
