package org.javai.nlq.data;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ValuesTest {

	@Test
	@DisplayName("null, blank text and NaN are missing")
	void missingValues() {
		assertThat(Values.isMissing(null)).isTrue();
		assertThat(Values.isMissing("  ")).isTrue();
		assertThat(Values.isMissing(Double.NaN)).isTrue();
		assertThat(Values.isMissing(0)).isFalse();
		assertThat(Values.isMissing("x")).isFalse();
	}

	@Test
	@DisplayName("numeric coercion accepts numbers and numeric text")
	void toDouble() {
		assertThat(Values.toDouble(12)).contains(12.0);
		assertThat(Values.toDouble(" 1,250.5 ")).contains(1250.5);
		assertThat(Values.toDouble("north")).isEmpty();
		assertThat(Values.toDouble(null)).isEmpty();
	}

	@Test
	@DisplayName("date coercion understands temporals and common text formats")
	void toDate() {
		assertThat(Values.toDate(LocalDate.of(2023, 4, 2))).contains(LocalDate.of(2023, 4, 2));
		assertThat(Values.toDate(LocalDateTime.of(2023, 4, 2, 13, 5))).contains(LocalDate.of(2023, 4, 2));
		assertThat(Values.toDate(YearMonth.of(2023, 4))).contains(LocalDate.of(2023, 4, 1));
		assertThat(Values.toDate("2023-04-02")).contains(LocalDate.of(2023, 4, 2));
		assertThat(Values.toDate("2023-04")).contains(LocalDate.of(2023, 4, 1));
		assertThat(Values.toDate("yesterday")).isEmpty();
		assertThat(Values.toDate(42)).isEmpty();
	}

	@Test
	@DisplayName("slash and dash dates read month first, day first only when the month cannot fit")
	void monthFirstDates() {
		assertThat(Values.toDate("12/31/2023")).contains(LocalDate.of(2023, 12, 31));
		assertThat(Values.toDate("03/01/2023")).contains(LocalDate.of(2023, 3, 1));
		assertThat(Values.toDate("1/5/2023")).contains(LocalDate.of(2023, 1, 5));
		assertThat(Values.toDate("06-15-2022")).contains(LocalDate.of(2022, 6, 15));
		assertThat(Values.toDate("31/12/2023")).contains(LocalDate.of(2023, 12, 31));
		assertThat(Values.toDate("25-04-2023")).contains(LocalDate.of(2023, 4, 25));
		assertThat(Values.toDate("2023/04/02")).contains(LocalDate.of(2023, 4, 2));
	}

	@Test
	@DisplayName("JDBC dates convert without going through an instant")
	void sqlDate() {
		assertThat(Values.toDate(java.sql.Date.valueOf("2023-03-01"))).contains(LocalDate.of(2023, 3, 1));
	}

	@Test
	@DisplayName("literals become double, long or text")
	void coerceLiteral() {
		assertThat(Values.coerceLiteral("2.5")).isEqualTo(2.5);
		assertThat(Values.coerceLiteral("2023")).isEqualTo(2023L);
		assertThat(Values.coerceLiteral("'north'")).isEqualTo("north");
		assertThat(Values.coerceLiteral("\"2023\"")).isEqualTo(2023L);
		assertThat(Values.coerceLiteral("north")).isEqualTo("north");
	}

	@Test
	@DisplayName("equality is numeric for numeric literals and textual otherwise")
	void scalarEquals() {
		assertThat(Values.scalarEquals(2023, 2023L)).isTrue();
		assertThat(Values.scalarEquals("2023", 2023L)).isTrue();
		assertThat(Values.scalarEquals(2.5, 2.5)).isTrue();
		assertThat(Values.scalarEquals("north", "north")).isTrue();
		assertThat(Values.scalarEquals("North", "north")).isFalse();
		assertThat(Values.scalarEquals(null, "north")).isFalse();
	}

	@Test
	@DisplayName("missing sort keys come last in both directions")
	void compareNullable() {
		assertThat(Values.compareNullable(1.0, 2.0, false)).isNegative();
		assertThat(Values.compareNullable(1.0, 2.0, true)).isPositive();
		assertThat(Values.compareNullable(null, 2.0, false)).isPositive();
		assertThat(Values.compareNullable(null, 2.0, true)).isPositive();
		assertThat(Values.compareNullable(null, null, true)).isZero();
	}
}
