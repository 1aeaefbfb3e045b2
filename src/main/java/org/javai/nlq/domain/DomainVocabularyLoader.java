package org.javai.nlq.domain;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link DomainVocabulary} definitions from YAML.
 *
 * <p>Expected shape:</p>
 * <pre>
 * domains:
 *   ecommerce:
 *     metrics: [gmv, revenue]
 *     dimensions: [brand, channel]
 * </pre>
 *
 * <p>{@link #loadDefaults()} reads the vocabularies bundled at {@value #DEFAULT_RESOURCE}.</p>
 */
public class DomainVocabularyLoader {

	private static final Logger logger = LoggerFactory.getLogger(DomainVocabularyLoader.class);

	public static final String DEFAULT_RESOURCE = "/nlq/domains.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads the bundled vocabularies.
	 *
	 * @return vocabularies keyed by domain name, in document order
	 */
	public Map<String, DomainVocabulary> loadDefaults() {
		try (InputStream in = DomainVocabularyLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (in == null) {
				throw new DomainVocabularyException("Missing classpath resource " + DEFAULT_RESOURCE);
			}
			return load(in);
		} catch (IOException e) {
			throw new DomainVocabularyException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	/**
	 * Loads one named vocabulary from the bundled set.
	 */
	public Optional<DomainVocabulary> loadDefault(String domain) {
		return Optional.ofNullable(loadDefaults().get(domain));
	}

	public Map<String, DomainVocabulary> load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (DomainVocabularyException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new DomainVocabularyException("Failed to parse domain vocabularies from input stream", e);
		}
	}

	public Map<String, DomainVocabulary> load(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (DomainVocabularyException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new DomainVocabularyException("Failed to parse domain vocabularies from reader", e);
		}
	}

	public Map<String, DomainVocabulary> loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (DomainVocabularyException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new DomainVocabularyException("Failed to parse domain vocabularies from string", e);
		}
	}

	private Map<String, DomainVocabulary> build(Object document) {
		if (!(document instanceof Map<?, ?> root)) {
			throw new DomainVocabularyException("Domain vocabulary document must be a mapping");
		}
		if (!(root.get("domains") instanceof Map<?, ?> domains)) {
			throw new DomainVocabularyException("Domain vocabulary document needs a 'domains' mapping");
		}
		Map<String, DomainVocabulary> result = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : domains.entrySet()) {
			String name = String.valueOf(entry.getKey());
			if (!(entry.getValue() instanceof Map<?, ?> body)) {
				throw new DomainVocabularyException("Domain '" + name + "' must be a mapping");
			}
			result.put(name, new DomainVocabulary(name,
					keywords(name, "metrics", body.get("metrics")),
					keywords(name, "dimensions", body.get("dimensions"))));
		}
		logger.debug("Loaded {} domain vocabularies: {}", result.size(), result.keySet());
		return result;
	}

	private static List<String> keywords(String domain, String key, Object value) {
		if (value == null) {
			return List.of();
		}
		if (!(value instanceof List<?> list)) {
			throw new DomainVocabularyException("Domain '" + domain + "' " + key + " must be a list");
		}
		return list.stream().map(String::valueOf).toList();
	}
}
