package org.javai.bali.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link BdnOptions} from YAML.
 * <p>
 * Recognised keys are {@code debug}, {@code indentation} and {@code max_inline_size}; missing
 * keys keep their defaults.
 * <pre>
 * debug: true
 * indentation: 4
 * max_inline_size: 60
 * </pre>
 */
public class BdnOptionsLoader {

	/**
	 * Classpath location consulted by {@link #loadDefaultResource(ClassLoader)}.
	 */
	public static final String DEFAULT_RESOURCE = "META-INF/bdn-options.yml";

	private static final Set<String> KEYS = Set.of("debug", "indentation", "max_inline_size");

	private final Yaml yaml = new Yaml();

	public BdnOptions load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read options from path: " + path, e);
		}
	}

	public BdnOptions load(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (YAMLException | ClassCastException e) {
			throw new IllegalArgumentException("Malformed options document", e);
		}
	}

	public BdnOptions loadString(String content) {
		try {
			return build(yaml.load(content));
		} catch (YAMLException | ClassCastException e) {
			throw new IllegalArgumentException("Malformed options document", e);
		}
	}

	public BdnOptions loadResource(String resource, ClassLoader classLoader) {
		InputStream stream = classLoader.getResourceAsStream(resource);
		if (stream == null) {
			throw new IllegalArgumentException("Options resource not found: " + resource);
		}
		try (stream) {
			return build(yaml.load(stream));
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read options resource: " + resource, e);
		} catch (YAMLException | ClassCastException e) {
			throw new IllegalArgumentException("Malformed options resource: " + resource, e);
		}
	}

	/**
	 * Loads {@value #DEFAULT_RESOURCE} when it is on the classpath, or returns the defaults.
	 */
	public BdnOptions loadDefaultResource(ClassLoader classLoader) {
		if (classLoader.getResource(DEFAULT_RESOURCE) == null) {
			return BdnOptions.defaults();
		}
		return loadResource(DEFAULT_RESOURCE, classLoader);
	}

	@SuppressWarnings("unchecked")
	private BdnOptions build(Object document) {
		if (document == null) {
			return BdnOptions.defaults();
		}
		if (!(document instanceof Map)) {
			throw new IllegalArgumentException("Options document must be a mapping, found: " + document);
		}
		Map<String, Object> data = (Map<String, Object>) document;
		for (String key : data.keySet()) {
			if (!KEYS.contains(key)) {
				throw new IllegalArgumentException("Unknown option '" + key + "'; expected one of " + KEYS);
			}
		}
		BdnOptions.Builder builder = BdnOptions.builder();
		if (data.containsKey("debug")) {
			builder.debug(value(data, "debug", Boolean.class));
		}
		if (data.containsKey("indentation")) {
			builder.indentation(value(data, "indentation", Integer.class));
		}
		if (data.containsKey("max_inline_size")) {
			builder.maxInlineSize(value(data, "max_inline_size", Integer.class));
		}
		return builder.build();
	}

	private static <T> T value(Map<String, Object> data, String key, Class<T> type) {
		Object value = data.get(key);
		if (!type.isInstance(value)) {
			throw new IllegalArgumentException("Option '" + key + "' must be of type " + type.getSimpleName()
					+ ", found: " + value);
		}
		return type.cast(value);
	}
}
