package org.javai.nlq.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import org.javai.nlq.spec.Aggregation;
import org.javai.nlq.spec.QuerySpecification;
import org.javai.nlq.spec.TaskType;

/**
 * Converts {@link QuerySpecification} to and from its snake_case JSON form, the shape shown to
 * users to explain how a prompt was understood.
 *
 * <pre>{@code
 * {"task":"rank","metrics":["sales"],"dimensions":["dealer_name"],"agg":"sum","top_n":5,
 *  "ascending":false,"filters":[],"confidence":0.8,"raw":"top 5 dealer by sales",
 *  "error":null,"suggestions":[],"matched_patterns":["rule:top_n",...],"time_column":null}
 * }</pre>
 */
public final class QuerySpecificationJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper();

	private QuerySpecificationJsonMapper() {
	}

	public static ObjectNode toJson(QuerySpecification spec) {
		ObjectNode node = mapper.createObjectNode();
		node.put("task", spec.task().wireName());
		putArray(node, "metrics", spec.metrics());
		putArray(node, "dimensions", spec.dimensions());
		node.put("agg", spec.agg().wireName());
		if (spec.topN() != null) {
			node.put("top_n", spec.topN());
		} else {
			node.putNull("top_n");
		}
		node.put("ascending", spec.ascending());
		putArray(node, "filters", spec.filters());
		node.put("confidence", spec.confidence());
		node.put("raw", spec.raw());
		node.put("error", spec.error());
		putArray(node, "suggestions", spec.suggestions());
		putArray(node, "matched_patterns", spec.matchedPatterns());
		node.put("time_column", spec.timeColumn());
		return node;
	}

	public static String toJsonString(QuerySpecification spec) {
		try {
			return mapper.writeValueAsString(toJson(spec));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize query specification", e);
		}
	}

	/**
	 * @throws QuerySpecificationFormatException if the text is not a valid specification
	 */
	public static QuerySpecification fromJson(String json) {
		if (json == null || json.isBlank()) {
			throw new QuerySpecificationFormatException("JSON content is empty");
		}
		try {
			return fromJson(mapper.readTree(json));
		} catch (JsonProcessingException e) {
			throw new QuerySpecificationFormatException("Malformed JSON: " + e.getOriginalMessage(), e);
		}
	}

	/**
	 * Reads a specification from a JSON tree. Absent optional fields take their defaults.
	 *
	 * @throws QuerySpecificationFormatException if the tree is not a valid specification
	 */
	public static QuerySpecification fromJson(JsonNode node) {
		if (node == null || !node.isObject()) {
			throw new QuerySpecificationFormatException("Expected a JSON object");
		}
		String taskName = text(node, "task");
		if (taskName == null) {
			throw new QuerySpecificationFormatException("Missing required field 'task'");
		}
		TaskType task = TaskType.fromWireName(taskName)
				.orElseThrow(() -> new QuerySpecificationFormatException("Unknown task: " + taskName));

		QuerySpecification.Builder builder = QuerySpecification.builder(task)
				.metrics(strings(node, "metrics"))
				.dimensions(strings(node, "dimensions"))
				.filters(strings(node, "filters"))
				.suggestions(strings(node, "suggestions"))
				.matchedPatterns(strings(node, "matched_patterns"))
				.raw(text(node, "raw"))
				.error(text(node, "error"))
				.timeColumn(text(node, "time_column"))
				.ascending(node.path("ascending").asBoolean(false))
				.confidence(node.path("confidence").asDouble(0.0));

		String aggName = text(node, "agg");
		if (aggName != null) {
			builder.agg(Aggregation.fromWireName(aggName)
					.orElseThrow(() -> new QuerySpecificationFormatException("Unknown aggregation: " + aggName)));
		}
		JsonNode topN = node.get("top_n");
		if (topN != null && !topN.isNull()) {
			if (!topN.canConvertToInt()) {
				throw new QuerySpecificationFormatException("top_n must be an integer: " + topN);
			}
			builder.topN(topN.asInt());
		}

		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new QuerySpecificationFormatException("Invalid query specification: " + e.getMessage(), e);
		}
	}

	private static void putArray(ObjectNode node, String field, List<String> values) {
		ArrayNode array = node.putArray(field);
		values.forEach(array::add);
	}

	private static String text(JsonNode node, String field) {
		JsonNode value = node.get(field);
		return value == null || value.isNull() ? null : value.asText();
	}

	private static List<String> strings(JsonNode node, String field) {
		JsonNode value = node.get(field);
		if (value == null || value.isNull()) {
			return List.of();
		}
		if (!value.isArray()) {
			throw new QuerySpecificationFormatException("Field '" + field + "' must be an array");
		}
		List<String> result = new ArrayList<>();
		value.forEach(item -> result.add(item.asText()));
		return result;
	}
}
