package org.javai.nlq;

import java.util.List;
import java.util.Objects;
import org.javai.nlq.data.Dataset;
import org.javai.nlq.domain.DomainVocabulary;
import org.javai.nlq.exec.QueryExecutor;
import org.javai.nlq.exec.QueryResult;
import org.javai.nlq.parse.PromptParser;
import org.javai.nlq.resolve.ColumnResolver;
import org.javai.nlq.spec.QuerySpecification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point answering natural-language questions about a table.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * NlQueryEngine engine = NlQueryEngine.builder()
 *         .vocabulary(new DomainVocabularyLoader().loadDefault("automotive").orElse(null))
 *         .build();
 *
 * QueryResult result = engine.ask("top 5 dealer by sales", dataset);
 * }</pre>
 *
 * <p>The engine is stateless between calls and may be shared.</p>
 */
public final class NlQueryEngine {

	private static final Logger logger = LoggerFactory.getLogger(NlQueryEngine.class);

	private final QueryEngineConfig config;
	private final DomainVocabulary vocabulary;
	private final PromptParser parser;
	private final QueryExecutor executor;

	private NlQueryEngine(Builder builder) {
		this.config = builder.config;
		this.vocabulary = builder.vocabulary;
		this.parser = builder.parser != null
				? builder.parser
				: new PromptParser(new ColumnResolver(config.similarityThreshold()));
		this.executor = builder.executor != null ? builder.executor : new QueryExecutor(config);
	}

	public static Builder builder() {
		return new Builder();
	}

	public QueryEngineConfig config() {
		return config;
	}

	public QuerySpecification parse(String prompt, List<String> columns) {
		return parser.parse(prompt, columns, vocabulary);
	}

	public QueryResult execute(QuerySpecification spec, Dataset dataset) {
		return executor.execute(spec, dataset);
	}

	/**
	 * Parses a prompt against the dataset's columns and executes the result. A prompt that cannot
	 * be understood yields a preview of the data alongside the error specification.
	 */
	public QueryResult ask(String prompt, Dataset dataset) {
		Objects.requireNonNull(dataset, "dataset must not be null");
		QuerySpecification spec = parse(prompt, dataset.columnNames());
		if (spec.isError()) {
			logger.info("Prompt not understood: {}", spec.error());
		}
		return execute(spec, dataset);
	}

	/**
	 * Builder for {@link NlQueryEngine}.
	 */
	public static final class Builder {
		private QueryEngineConfig config = QueryEngineConfig.defaults();
		private DomainVocabulary vocabulary;
		private PromptParser parser;
		private QueryExecutor executor;

		private Builder() {}

		public Builder config(QueryEngineConfig config) {
			this.config = Objects.requireNonNull(config, "config must not be null");
			return this;
		}

		/**
		 * Sets the domain vocabulary consulted while parsing; {@code null} parses without one.
		 */
		public Builder vocabulary(DomainVocabulary vocabulary) {
			this.vocabulary = vocabulary;
			return this;
		}

		public Builder parser(PromptParser parser) {
			this.parser = parser;
			return this;
		}

		public Builder executor(QueryExecutor executor) {
			this.executor = executor;
			return this;
		}

		public NlQueryEngine build() {
			return new NlQueryEngine(this);
		}
	}
}
