package org.javai.nlq;

/**
 * Tuning knobs for parsing and execution.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * QueryEngineConfig config = QueryEngineConfig.defaults();
 *
 * // Custom configuration
 * QueryEngineConfig config = QueryEngineConfig.builder()
 *         .similarityThreshold(0.7)
 *         .maxRows(500)
 *         .build();
 * }</pre>
 *
 * @param similarityThreshold minimum edit-distance similarity for a fuzzy column match, in [0,1]
 * @param defaultTopN row limit for ranking when the prompt names none
 * @param previewRows row limit for every other task when the prompt names none
 * @param errorPreviewRows rows returned alongside an execution failure
 * @param maxRows hard cap on any result
 * @param maxMetrics metrics the executor honours
 * @param maxDimensions dimensions the executor honours
 */
public record QueryEngineConfig(
		double similarityThreshold,
		int defaultTopN,
		int previewRows,
		int errorPreviewRows,
		int maxRows,
		int maxMetrics,
		int maxDimensions
) {

	public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.6;
	public static final int DEFAULT_TOP_N = 10;
	public static final int DEFAULT_PREVIEW_ROWS = 100;
	public static final int DEFAULT_ERROR_PREVIEW_ROWS = 10;
	public static final int DEFAULT_MAX_ROWS = 1000;
	public static final int DEFAULT_MAX_METRICS = 3;
	public static final int DEFAULT_MAX_DIMENSIONS = 2;

	public QueryEngineConfig {
		if (Double.isNaN(similarityThreshold) || similarityThreshold < 0.0 || similarityThreshold > 1.0) {
			throw new IllegalArgumentException("similarityThreshold must be within [0,1]");
		}
		requirePositive("defaultTopN", defaultTopN);
		requirePositive("previewRows", previewRows);
		requirePositive("maxRows", maxRows);
		if (errorPreviewRows < 0) {
			throw new IllegalArgumentException("errorPreviewRows must be non-negative");
		}
		if (maxMetrics < 1 || maxMetrics > DEFAULT_MAX_METRICS) {
			throw new IllegalArgumentException("maxMetrics must be between 1 and " + DEFAULT_MAX_METRICS);
		}
		if (maxDimensions < 1 || maxDimensions > DEFAULT_MAX_DIMENSIONS) {
			throw new IllegalArgumentException("maxDimensions must be between 1 and " + DEFAULT_MAX_DIMENSIONS);
		}
	}

	private static void requirePositive(String name, int value) {
		if (value <= 0) {
			throw new IllegalArgumentException(name + " must be positive");
		}
	}

	/**
	 * Creates a configuration with default values.
	 *
	 * @return default configuration
	 */
	public static QueryEngineConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link QueryEngineConfig}.
	 */
	public static class Builder {
		private double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;
		private int defaultTopN = DEFAULT_TOP_N;
		private int previewRows = DEFAULT_PREVIEW_ROWS;
		private int errorPreviewRows = DEFAULT_ERROR_PREVIEW_ROWS;
		private int maxRows = DEFAULT_MAX_ROWS;
		private int maxMetrics = DEFAULT_MAX_METRICS;
		private int maxDimensions = DEFAULT_MAX_DIMENSIONS;

		private Builder() {}

		public Builder similarityThreshold(double similarityThreshold) {
			this.similarityThreshold = similarityThreshold;
			return this;
		}

		public Builder defaultTopN(int defaultTopN) {
			this.defaultTopN = defaultTopN;
			return this;
		}

		/**
		 * Sets the row limit used by non-ranking tasks when the specification carries no
		 * explicit limit.
		 *
		 * @param previewRows the preview size (must be positive)
		 * @return this builder
		 */
		public Builder previewRows(int previewRows) {
			this.previewRows = previewRows;
			return this;
		}

		public Builder errorPreviewRows(int errorPreviewRows) {
			this.errorPreviewRows = errorPreviewRows;
			return this;
		}

		/**
		 * Sets the hard cap applied to every result, whatever limit the specification asks for.
		 *
		 * @param maxRows the cap (must be positive)
		 * @return this builder
		 */
		public Builder maxRows(int maxRows) {
			this.maxRows = maxRows;
			return this;
		}

		public Builder maxMetrics(int maxMetrics) {
			this.maxMetrics = maxMetrics;
			return this;
		}

		public Builder maxDimensions(int maxDimensions) {
			this.maxDimensions = maxDimensions;
			return this;
		}

		public QueryEngineConfig build() {
			return new QueryEngineConfig(similarityThreshold, defaultTopN, previewRows, errorPreviewRows,
					maxRows, maxMetrics, maxDimensions);
		}
	}
}
