package org.javai.nlq.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import org.javai.nlq.data.Dataset;
import org.javai.nlq.data.Values;

/**
 * Renders a result table as JSON records: {@code {"columns":[...],"data":[{...}],"row_count":n}}.
 * Temporal values are written in ISO form and missing values as {@code null}.
 */
public final class DatasetJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper();

	private DatasetJsonMapper() {
	}

	public static ObjectNode toJson(Dataset dataset) {
		ObjectNode node = mapper.createObjectNode();
		ArrayNode columns = node.putArray("columns");
		dataset.columnNames().forEach(columns::add);
		ArrayNode data = node.putArray("data");
		for (int row = 0; row < dataset.rowCount(); row++) {
			ObjectNode record = data.addObject();
			for (String column : dataset.columnNames()) {
				putValue(record, column, dataset.value(row, column));
			}
		}
		node.put("row_count", dataset.rowCount());
		return node;
	}

	public static String toJsonString(Dataset dataset) {
		try {
			return mapper.writeValueAsString(toJson(dataset));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize dataset", e);
		}
	}

	private static void putValue(ObjectNode record, String field, Object value) {
		if (Values.isMissing(value)) {
			record.putNull(field);
		} else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			record.put(field, ((Number) value).intValue());
		} else if (value instanceof Long l) {
			record.put(field, l);
		} else if (value instanceof BigInteger b) {
			record.put(field, b);
		} else if (value instanceof BigDecimal b) {
			record.put(field, b);
		} else if (value instanceof Number n) {
			record.put(field, n.doubleValue());
		} else if (value instanceof Boolean b) {
			record.put(field, b);
		} else {
			record.put(field, value.toString());
		}
	}
}
