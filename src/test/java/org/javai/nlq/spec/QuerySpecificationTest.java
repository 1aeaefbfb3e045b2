package org.javai.nlq.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class QuerySpecificationTest {

	@Nested
	@DisplayName("Invariants")
	class Invariants {

		@Test
		@DisplayName("agg defaults to sum and lists are never null")
		void defaults() {
			QuerySpecification spec = new QuerySpecification(TaskType.EXPLORE, null, null, null, null, false,
					null, 0.3, "x", null, null, null, null);

			assertThat(spec.agg()).isEqualTo(Aggregation.SUM);
			assertThat(spec.metrics()).isEmpty();
			assertThat(spec.filters()).isEmpty();
		}

		@Test
		@DisplayName("confidence outside [0,1] is rejected")
		void confidenceRange() {
			assertThatThrownBy(() -> QuerySpecification.builder(TaskType.RANK).confidence(1.2).build())
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("non-positive topN is rejected")
		void topNPositive() {
			assertThatThrownBy(() -> QuerySpecification.builder(TaskType.RANK).topN(0).build())
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("more than five bound columns is rejected")
		void boundColumns() {
			QuerySpecification.Builder builder = QuerySpecification.builder(TaskType.GROUP_BY)
					.metrics(List.of("a", "b", "c"))
					.dimensions(List.of("d", "e", "f"));

			assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("lists are defensive copies without nulls")
		void defensiveCopies() {
			List<String> metrics = new java.util.ArrayList<>(Arrays.asList("sales", null));
			QuerySpecification spec = QuerySpecification.builder(TaskType.AGGREGATE).metrics(metrics).build();
			metrics.add("profit");

			assertThat(spec.metrics()).containsExactly("sales");
			assertThatThrownBy(() -> spec.metrics().add("x")).isInstanceOf(UnsupportedOperationException.class);
		}
	}

	@Nested
	@DisplayName("Derived views and copies")
	class Copies {

		@Test
		@DisplayName("error factory has zero confidence")
		void errorFactory() {
			QuerySpecification spec = QuerySpecification.error("??", "Empty query", List.of("count by region"));

			assertThat(spec.isError()).isTrue();
			assertThat(spec.confidence()).isZero();
			assertThat(spec.suggestions()).containsExactly("count by region");
		}

		@Test
		@DisplayName("row-count placeholder is not a column metric")
		void countRows() {
			QuerySpecification spec = QuerySpecification.builder(TaskType.GROUP_COUNT)
					.addMetric(QuerySpecification.COUNT_ROWS)
					.addDimension("region")
					.build();

			assertThat(spec.countsRows()).isTrue();
			assertThat(spec.columnMetrics()).isEmpty();
		}

		@Test
		@DisplayName("with-methods return amended copies")
		void withMethods() {
			QuerySpecification spec = QuerySpecification.builder(TaskType.RANK)
					.addMetric("sales")
					.addDimension("dealer")
					.confidence(0.8)
					.build();

			QuerySpecification amended = spec.withColumns(List.of("sales"), List.of()).withTask(TaskType.EXPLORE);

			assertThat(spec.dimensions()).containsExactly("dealer");
			assertThat(amended.dimensions()).isEmpty();
			assertThat(amended.task()).isEqualTo(TaskType.EXPLORE);
			assertThat(amended.confidence()).isEqualTo(0.8);
			assertThat(spec.withError("boom").hasError()).isTrue();
		}
	}

	@Nested
	@DisplayName("Aggregation")
	class Aggregations {

		@Test
		@DisplayName("verbs map to aggregations")
		void verbs() {
			assertThat(Aggregation.fromVerb("Total")).contains(Aggregation.SUM);
			assertThat(Aggregation.fromVerb("average")).contains(Aggregation.MEAN);
			assertThat(Aggregation.fromVerb("maximum")).contains(Aggregation.MAX);
			assertThat(Aggregation.fromVerb("spread")).isEmpty();
		}

		@Test
		@DisplayName("aggregations compute over values")
		void apply() {
			List<Double> values = List.of(4.0, 1.0, 3.0, 2.0);

			assertThat(Aggregation.SUM.apply(values)).isEqualTo(10.0);
			assertThat(Aggregation.MEAN.apply(values)).isCloseTo(2.5, within(1e-9));
			assertThat(Aggregation.COUNT.apply(values)).isEqualTo(4.0);
			assertThat(Aggregation.MIN.apply(values)).isEqualTo(1.0);
			assertThat(Aggregation.MAX.apply(values)).isEqualTo(4.0);
			assertThat(Aggregation.MEDIAN.apply(values)).isEqualTo(2.5);
		}

		@Test
		@DisplayName("empty input sums to zero and has no mean")
		void emptyInput() {
			assertThat(Aggregation.SUM.apply(List.of())).isEqualTo(0.0);
			assertThat(Aggregation.MEAN.apply(List.of())).isNull();
		}

		@Test
		@DisplayName("task wire names round-trip")
		void taskWireNames() {
			assertThat(TaskType.GROUP_COUNT.wireName()).isEqualTo("group_count");
			assertThat(TaskType.fromWireName("aggregate_by")).contains(TaskType.AGGREGATE_BY);
			assertThat(TaskType.fromWireName("pivot")).isEmpty();
		}
	}
}
