package org.javai.nlq.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DomainVocabularyLoaderTest {

	private final DomainVocabularyLoader loader = new DomainVocabularyLoader();

	@Nested
	@DisplayName("Bundled vocabularies")
	class Bundled {

		@Test
		@DisplayName("loads every bundled domain in document order")
		void loadsAllDomains() {
			Map<String, DomainVocabulary> domains = loader.loadDefaults();

			assertThat(domains.keySet()).startsWith("ecommerce", "automotive")
					.contains("manufacturing", "retail", "finance", "healthcare", "generic");
		}

		@Test
		@DisplayName("automotive treats sales as a metric and dealer as a dimension")
		void automotive() {
			DomainVocabulary automotive = loader.loadDefault("automotive").orElseThrow();

			assertThat(automotive.isMetric("total_sales")).isTrue();
			assertThat(automotive.isDimension("Dealer_Name")).isTrue();
			assertThat(automotive.recognizes("weather")).isFalse();
		}

		@Test
		@DisplayName("unknown domain is empty")
		void unknownDomain() {
			assertThat(loader.loadDefault("astronomy")).isEmpty();
		}
	}

	@Nested
	@DisplayName("Caller-supplied YAML")
	class Supplied {

		private static final String YAML = """
				domains:
				  logistics:
				    metrics: [Weight, distance]
				    dimensions: [carrier]
				""";

		@Test
		@DisplayName("loads from string, reader and stream alike")
		void loadsFromAllSources() {
			DomainVocabulary fromString = loader.loadString(YAML).get("logistics");
			DomainVocabulary fromReader = loader.load(new StringReader(YAML)).get("logistics");
			DomainVocabulary fromStream = loader.load(
					new ByteArrayInputStream(YAML.getBytes(StandardCharsets.UTF_8))).get("logistics");

			assertThat(fromString).isEqualTo(fromReader).isEqualTo(fromStream);
			assertThat(fromString.metrics()).containsExactly("weight", "distance");
		}

		@Test
		@DisplayName("missing keyword lists are empty")
		void missingLists() {
			DomainVocabulary vocabulary = loader.loadString("domains:\n  bare: {}\n").get("bare");

			assertThat(vocabulary.metrics()).isEmpty();
			assertThat(vocabulary.dimensions()).isEmpty();
		}

		@Test
		@DisplayName("document without a domains mapping is rejected")
		void missingDomains() {
			assertThatThrownBy(() -> loader.loadString("other: 1"))
					.isInstanceOf(DomainVocabularyException.class)
					.hasMessageContaining("domains");
		}

		@Test
		@DisplayName("keyword list that is not a list is rejected")
		void scalarKeywords() {
			assertThatThrownBy(() -> loader.loadString("domains:\n  x:\n    metrics: sales\n"))
					.isInstanceOf(DomainVocabularyException.class)
					.hasMessageContaining("metrics must be a list");
		}

		@Test
		@DisplayName("malformed YAML is wrapped")
		void malformedYaml() {
			assertThatThrownBy(() -> loader.loadString("domains: [unclosed"))
					.isInstanceOf(DomainVocabularyException.class)
					.hasCauseInstanceOf(RuntimeException.class);
		}
	}
}
