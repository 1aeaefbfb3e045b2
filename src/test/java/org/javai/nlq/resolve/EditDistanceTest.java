package org.javai.nlq.resolve;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class EditDistanceTest {

	@Test
	void levenshteinCountsEdits() {
		assertThat(EditDistance.levenshtein("kitten", "sitting")).isEqualTo(3);
		assertThat(EditDistance.levenshtein("", "abc")).isEqualTo(3);
		assertThat(EditDistance.levenshtein("same", "same")).isZero();
	}

	@Test
	void similarityIsNormalizedByLongerLength() {
		assertThat(EditDistance.similarity("revnue", "revenue")).isCloseTo(1.0 - 1.0 / 7.0, within(1e-9));
		assertThat(EditDistance.similarity("abc", "xyz")).isZero();
		assertThat(EditDistance.similarity("", "")).isEqualTo(1.0);
	}
}
