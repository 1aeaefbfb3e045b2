package org.javai.nlq.json;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.nlq.parse.PromptParser;
import org.javai.nlq.spec.Aggregation;
import org.javai.nlq.spec.QuerySpecification;
import org.javai.nlq.spec.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class QuerySpecificationJsonMapperTest {

	@Nested
	@DisplayName("Writing")
	class Writing {

		@Test
		@DisplayName("uses snake_case wire names")
		void snakeCase() {
			QuerySpecification spec = new PromptParser()
					.parse("top 5 dealer by sales", List.of("dealer_name", "sales", "order_date"));

			ObjectNode json = QuerySpecificationJsonMapper.toJson(spec);

			assertThat(json.get("task").asText()).isEqualTo("rank");
			assertThat(json.get("agg").asText()).isEqualTo("sum");
			assertThat(json.get("top_n").asInt()).isEqualTo(5);
			assertThat(json.get("time_column").asText()).isEqualTo("order_date");
			assertThat(json.get("metrics").get(0).asText()).isEqualTo("sales");
			assertThat(json.get("matched_patterns").get(0).asText()).isEqualTo("rule:top_n");
			assertThat(json.get("error").isNull()).isTrue();
		}

		@Test
		@DisplayName("absent topN is written as null")
		void nullTopN() {
			QuerySpecification spec = QuerySpecification.builder(TaskType.EXPLORE).confidence(0.3).build();

			assertThat(QuerySpecificationJsonMapper.toJson(spec).get("top_n").isNull()).isTrue();
		}
	}

	@Nested
	@DisplayName("Reading")
	class Reading {

		@Test
		@DisplayName("reads back what it writes")
		void readsBack() {
			QuerySpecification spec = QuerySpecification.builder(TaskType.AGGREGATE_BY)
					.addMetric("revenue")
					.addDimension("region")
					.agg(Aggregation.MEDIAN)
					.addFilter("year==2023")
					.confidence(0.85)
					.raw("median revenue by region in 2023")
					.timeColumn("order_date")
					.build();

			String json = QuerySpecificationJsonMapper.toJsonString(spec);

			assertThat(QuerySpecificationJsonMapper.fromJson(json)).isEqualTo(spec);
		}

		@Test
		@DisplayName("optional fields take their defaults")
		void defaults() {
			QuerySpecification spec = QuerySpecificationJsonMapper.fromJson("{\"task\":\"explore\"}");

			assertThat(spec.task()).isEqualTo(TaskType.EXPLORE);
			assertThat(spec.agg()).isEqualTo(Aggregation.SUM);
			assertThat(spec.topN()).isNull();
			assertThat(spec.metrics()).isEmpty();
		}

		@Test
		@DisplayName("malformed JSON is reported as a format error")
		void malformedJson() {
			assertThatThrownBy(() -> QuerySpecificationJsonMapper.fromJson("{\"task\":"))
					.isInstanceOf(QuerySpecificationFormatException.class)
					.hasMessageStartingWith("Malformed JSON");
		}

		@Test
		@DisplayName("unknown names and invalid values are format errors")
		void invalidContent() {
			assertThatThrownBy(() -> QuerySpecificationJsonMapper.fromJson("{\"task\":\"pivot\"}"))
					.isInstanceOf(QuerySpecificationFormatException.class)
					.hasMessageContaining("pivot");
			assertThatThrownBy(() -> QuerySpecificationJsonMapper.fromJson("{\"task\":\"rank\",\"agg\":\"mode\"}"))
					.isInstanceOf(QuerySpecificationFormatException.class);
			assertThatThrownBy(() -> QuerySpecificationJsonMapper.fromJson("{\"task\":\"rank\",\"top_n\":-1}"))
					.isInstanceOf(QuerySpecificationFormatException.class)
					.hasCauseInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> QuerySpecificationJsonMapper.fromJson("{\"metrics\":[]}"))
					.isInstanceOf(QuerySpecificationFormatException.class)
					.hasMessageContaining("task");
			assertThatThrownBy(() -> QuerySpecificationJsonMapper.fromJson("[]"))
					.isInstanceOf(QuerySpecificationFormatException.class);
		}
	}
}
