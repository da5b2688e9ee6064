package com.shortphrase.infrastructure.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shortphrase.domain.rewrite.model.OracleItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns the provider's JSON answer into one {@link OracleItem} per requested sentence.
 * A sentence whose entry is missing or unreadable gets a malformed item; the others are unaffected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OracleResponseParser {

    // "1. ", "2) ", "- ", "• ", "* "
    private static final Pattern LEADING_MARKER = Pattern.compile("^(?:\\d+[.)]|[-•*])\\s+");

    // ```json ... ``` fences some models add despite the JSON response format
    private static final Pattern CODE_FENCE = Pattern.compile("^```(?:json)?\\s*|\\s*```$");

    private final ObjectMapper objectMapper;

    public List<OracleItem> parse(String content, int expectedCount) {
        if (content == null || content.isBlank()) {
            return allMalformed(expectedCount, "empty response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(CODE_FENCE.matcher(content.strip()).replaceAll(""));
        } catch (JsonProcessingException e) {
            log.warn("Oracle response is not valid JSON: {}", e.getOriginalMessage());
            return allMalformed(expectedCount, "response is not valid JSON");
        }

        JsonNode results = root.isArray() ? root : root.path("results");
        if (!results.isArray()) {
            return allMalformed(expectedCount, "response has no 'results' array");
        }

        Map<Integer, JsonNode> byId = new HashMap<>();
        for (int position = 0; position < results.size(); position++) {
            JsonNode entry = results.get(position);
            int id = entry.path("id").canConvertToInt() ? entry.path("id").asInt() : position + 1;
            byId.putIfAbsent(id, entry);
        }

        List<OracleItem> items = new ArrayList<>(expectedCount);
        for (int id = 1; id <= expectedCount; id++) {
            JsonNode entry = byId.get(id);
            items.add(entry == null
                    ? OracleItem.malformed("no entry for sentence " + id)
                    : toItem(entry, id));
        }
        return items;
    }

    private OracleItem toItem(JsonNode entry, int id) {
        JsonNode sentences = entry.isArray() ? entry : entry.path("sentences");
        if (!sentences.isArray() || sentences.isEmpty()) {
            return OracleItem.malformed("entry " + id + " has no sentences");
        }
        List<String> fragments = new ArrayList<>();
        for (JsonNode sentence : sentences) {
            if (!sentence.isTextual()) {
                return OracleItem.malformed("entry " + id + " contains a non-text sentence");
            }
            fragments.add(cleanFragment(sentence.asText()));
        }
        return OracleItem.of(fragments);
    }

    /**
     * Strip list markers and wrapping quotes the model may add around a sentence.
     */
    public static String cleanFragment(String fragment) {
        String cleaned = LEADING_MARKER.matcher(fragment.strip()).replaceFirst("").strip();
        if (cleaned.length() >= 2) {
            char first = cleaned.charAt(0);
            char last = cleaned.charAt(cleaned.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                cleaned = cleaned.substring(1, cleaned.length() - 1).strip();
            }
        }
        return cleaned;
    }

    private static List<OracleItem> allMalformed(int count, String detail) {
        List<OracleItem> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            items.add(OracleItem.malformed(detail));
        }
        return items;
    }
}
