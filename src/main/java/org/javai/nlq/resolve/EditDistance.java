package org.javai.nlq.resolve;

/**
 * Levenshtein distance and the normalized similarity ratio derived from it.
 */
public final class EditDistance {

	private EditDistance() {
		// Utility class
	}

	/**
	 * Classic two-row Levenshtein distance.
	 */
	public static int levenshtein(CharSequence one, CharSequence another) {
		int n = one.length();
		int m = another.length();
		if (n == 0) {
			return m;
		}
		if (m == 0) {
			return n;
		}
		if (n > m) {
			// keep the shorter string in the cost arrays
			CharSequence tmp = one;
			one = another;
			another = tmp;
			n = m;
			m = another.length();
		}

		int[] previous = new int[n + 1];
		int[] current = new int[n + 1];
		for (int i = 0; i <= n; i++) {
			previous[i] = i;
		}
		for (int j = 1; j <= m; j++) {
			char c = another.charAt(j - 1);
			current[0] = j;
			for (int i = 1; i <= n; i++) {
				int cost = one.charAt(i - 1) == c ? 0 : 1;
				current[i] = Math.min(Math.min(current[i - 1] + 1, previous[i] + 1), previous[i - 1] + cost);
			}
			int[] swap = previous;
			previous = current;
			current = swap;
		}
		return previous[n];
	}

	/**
	 * Similarity in [0,1]: {@code 1 - distance / max(length)}. Two empty strings are identical.
	 */
	public static double similarity(String one, String another) {
		int longest = Math.max(one.length(), another.length());
		if (longest == 0) {
			return 1.0;
		}
		return 1.0 - (double) levenshtein(one, another) / longest;
	}
}
