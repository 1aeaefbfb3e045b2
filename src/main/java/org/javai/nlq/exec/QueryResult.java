package org.javai.nlq.exec;

import java.util.Objects;
import org.javai.nlq.data.Dataset;
import org.javai.nlq.spec.QuerySpecification;

/**
 * Outcome of executing a specification.
 *
 * @param table the bounded result table
 * @param specification the specification as actually executed; it differs from the requested one
 *        when references were dropped, the task was downgraded, or execution failed, in which case
 *        {@link QuerySpecification#error()} is set
 */
public record QueryResult(Dataset table, QuerySpecification specification) {

	public QueryResult {
		Objects.requireNonNull(table, "table must not be null");
		Objects.requireNonNull(specification, "specification must not be null");
	}

	public boolean failed() {
		return specification.hasError();
	}
}
