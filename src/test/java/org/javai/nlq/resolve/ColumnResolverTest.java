package org.javai.nlq.resolve;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ColumnResolverTest {

	private final ColumnResolver resolver = new ColumnResolver();

	@Nested
	@DisplayName("Cascade order")
	class Cascade {

		@Test
		@DisplayName("exact match ignores case")
		void exactMatch() {
			assertThat(resolver.resolve("Sales", List.of("region", "sales"))).contains("sales");
		}

		@Test
		@DisplayName("exact match wins over an earlier substring match")
		void exactBeatsSubstring() {
			assertThat(resolver.resolve("sales", List.of("sales_target", "sales"))).contains("sales");
		}

		@Test
		@DisplayName("multi-word token matches its underscored column")
		void multiWordToken() {
			assertThat(resolver.resolve("dealer name", List.of("region", "dealer_name"))).contains("dealer_name");
		}

		@Test
		@DisplayName("plural token matches singular column")
		void pluralToken() {
			assertThat(resolver.resolve("regions", List.of("revenue", "region"))).contains("region");
		}

		@Test
		@DisplayName("token contained in column name")
		void substringOfColumn() {
			assertThat(resolver.resolve("dealer", List.of("dealer_name", "sales"))).contains("dealer_name");
		}

		@Test
		@DisplayName("column name contained in token")
		void columnInsideToken() {
			assertThat(resolver.resolve("revenue in 2023", List.of("region", "revenue"))).contains("revenue");
		}

		@Test
		@DisplayName("close misspelling resolves by edit distance")
		void misspelling() {
			assertThat(resolver.resolve("revnue", List.of("region", "revenue"))).contains("revenue");
		}

		@Test
		@DisplayName("unrelated token resolves to nothing")
		void unrelated() {
			assertThat(resolver.resolve("asdkjaslkdj", List.of("region", "revenue"))).isEmpty();
		}
	}

	@Nested
	@DisplayName("Edge cases")
	class EdgeCases {

		@Test
		@DisplayName("blank token or no columns resolve to nothing")
		void blankInputs() {
			assertThat(resolver.resolve("  ", List.of("sales"))).isEmpty();
			assertThat(resolver.resolve(null, List.of("sales"))).isEmpty();
			assertThat(resolver.resolve("sales", List.of())).isEmpty();
		}

		@Test
		@DisplayName("ties go to the first column")
		void tiesGoToFirstColumn() {
			assertThat(resolver.resolve("name", List.of("dealer_name", "model_name"))).contains("dealer_name");
		}

		@Test
		@DisplayName("resolution is deterministic")
		void deterministic() {
			List<String> columns = List.of("order_date", "sales_amount", "region", "segment");
			String first = resolver.resolve("amount", columns).orElseThrow();

			for (int i = 0; i < 20; i++) {
				assertThat(resolver.resolve("amount", columns)).contains(first);
			}
		}

		@Test
		@DisplayName("a stricter threshold rejects weaker fuzzy matches")
		void stricterThreshold() {
			ColumnResolver strict = new ColumnResolver(0.95);

			assertThat(strict.resolve("revnue", List.of("region", "revenue"))).isEmpty();
		}

		@Test
		@DisplayName("threshold outside [0,1] is rejected")
		void invalidThreshold() {
			assertThatThrownBy(() -> new ColumnResolver(1.5)).isInstanceOf(IllegalArgumentException.class);
		}
	}
}
