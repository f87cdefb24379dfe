package com.maestro.core.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maestro.core.model.PlanItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses planner output into {@link PlanItem}s.
 * <p>
 * Accepts either a bare JSON array of items or a document
 * {@code {"name": ..., "objective": ..., "tasks": [...]}}. Markdown code fences around
 * the JSON, as language models tend to emit, are stripped first.
 */
@Component
public class PlanParser {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * A parsed plan document. Name and objective are null for bare arrays.
     */
    public record ParsedPlan(String name, String objective, List<PlanItem> items) {}

    public ParsedPlan parse(String text) {
        if (text == null || text.isBlank()) {
            throw new PlanParseException("Plan is empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(text));
        } catch (JsonProcessingException e) {
            throw new PlanParseException("Plan is not valid JSON: " + e.getOriginalMessage(), e);
        }

        if (root.isArray()) {
            return new ParsedPlan(null, null, readItems(root));
        }
        if (root.isObject() && root.path("tasks").isArray()) {
            return new ParsedPlan(textOrNull(root.get("name")), textOrNull(root.get("objective")),
                    readItems(root.get("tasks")));
        }
        throw new PlanParseException("Plan must be a JSON array or an object with a 'tasks' array");
    }

    private List<PlanItem> readItems(JsonNode array) {
        var items = new ArrayList<PlanItem>();
        int index = 0;
        for (JsonNode node : array) {
            index++;
            if (!node.isObject()) {
                throw new PlanParseException("Plan item " + index + " is not an object");
            }
            try {
                items.add(objectMapper.treeToValue(node, PlanItem.class));
            } catch (JsonProcessingException e) {
                throw new PlanParseException("Plan item " + index + " is malformed: " + e.getOriginalMessage(), e);
            }
            if (items.get(items.size() - 1).task() == null) {
                throw new PlanParseException("Plan item " + index + " has no 'task' text");
            }
        }
        return items;
    }

    static String stripCodeFence(String text) {
        String clean = text.strip();
        int jsonFence = clean.indexOf("```json");
        if (jsonFence >= 0) {
            return between(clean, jsonFence + "```json".length());
        }
        int fence = clean.indexOf("```");
        if (fence >= 0) {
            return between(clean, fence + 3);
        }
        return clean;
    }

    private static String between(String text, int start) {
        int end = text.indexOf("```", start);
        return (end < 0 ? text.substring(start) : text.substring(start, end)).strip();
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
