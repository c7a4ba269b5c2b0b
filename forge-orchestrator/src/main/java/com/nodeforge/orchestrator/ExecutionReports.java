package com.nodeforge.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nodeforge.hooks.HookOutcome;
import com.nodeforge.plugin.PluginCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * JSON rendering of execution results for logs and CLI output. Plugin results are arbitrary
 * objects; one that Jackson cannot serialize is written as its {@code toString()}.
 */
public final class ExecutionReports {

    private static final Logger log = LoggerFactory.getLogger(ExecutionReports.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ExecutionReports() {
    }

    /** One JSON object per result, in the given order. */
    public static ArrayNode toTree(List<ExecutionResult> results) {
        ArrayNode array = MAPPER.createArrayNode();
        for (ExecutionResult r : results) {
            array.add(toTree(r));
        }
        return array;
    }

    public static ObjectNode toTree(ExecutionResult r) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("plugin", r.getPluginName());
        node.put("version", r.getVersion());
        node.put("category", r.getCategory() != null ? r.getCategory().toValue() : null);
        node.put("success", r.isSuccess());
        if (r.isSuccess()) {
            node.set("result", resultNode(r));
        } else {
            node.put("error", r.getErrorMessage());
            node.put("errorKind", r.getErrorKind().name());
            if (r.getFailedPhase() != null) {
                node.put("failedPhase", r.getFailedPhase());
            }
        }
        ObjectNode metrics = node.putObject("metrics");
        DurationMetrics m = r.getDurationMetrics();
        metrics.put("startedAt", m.getStartedAt() != null ? m.getStartedAt().toString() : null);
        metrics.put("durationMs", m.getDurationMs());
        metrics.put("hookDurationMs", m.getHookDurationMs());
        ArrayNode hooks = node.putArray("hooks");
        for (HookOutcome o : r.getHookOutcomes()) {
            ObjectNode h = hooks.addObject();
            h.put("name", o.getHookName());
            h.put("event", o.getEvent().toValue());
            h.put("status", o.getStatus().name());
            h.put("durationMs", o.getDurationMs());
            if (o.getErrorMessage() != null) {
                h.put("error", o.getErrorMessage());
            }
        }
        return node;
    }

    private static JsonNode resultNode(ExecutionResult r) {
        Object result = r.getResult();
        try {
            return MAPPER.valueToTree(result);
        } catch (IllegalArgumentException e) {
            log.debug("Result of plugin {} is not serializable, writing it as text: {}", r.getPluginName(), e.getMessage());
            return MAPPER.getNodeFactory().textNode(String.valueOf(result));
        }
    }

    public static String toJson(List<ExecutionResult> results) {
        try {
            return MAPPER.writeValueAsString(toTree(results));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Success and failure counts per category, categories in enum order. */
    public static Map<PluginCategory, int[]> countByCategory(List<ExecutionResult> results) {
        Map<PluginCategory, int[]> counts = new EnumMap<>(PluginCategory.class);
        for (ExecutionResult r : results) {
            int[] c = counts.computeIfAbsent(r.getCategory(), k -> new int[2]);
            c[r.isSuccess() ? 0 : 1]++;
        }
        return counts;
    }

    /** One line per category, e.g. {@code api: 2 succeeded, 1 failed}. */
    public static String summary(List<ExecutionResult> results) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<PluginCategory, int[]> e : countByCategory(results).entrySet()) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(e.getKey().toValue()).append(": ")
                    .append(e.getValue()[0]).append(" succeeded, ")
                    .append(e.getValue()[1]).append(" failed");
        }
        return sb.toString();
    }
}
