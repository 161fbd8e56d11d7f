package com.planetmap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Startup defaults read from a YAML resource on the classpath. Values are never written back.
 *
 * @param planet {@code null} for custom flattening and rotation period
 */
public record AppConfig(
		int fps,
		boolean bounceBack,
		Duration frameInterval,
		Planet planet,
		ProjectionType projectionType,
		int pollIntervalMs)
{
	private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

	public static final String DEFAULT_RESOURCE = "/planetmap.yml";

	public static AppConfig defaults()
	{
		return new AppConfig(25, true, Duration.ofSeconds(60), Planet.JUPITER, ProjectionType.EQUIRECTANGULAR, 40);
	}

	public static AppConfig load()
	{
		return load(DEFAULT_RESOURCE);
	}

	public static AppConfig load(String resource)
	{
		Map<String, Object> yaml = loadYamlResource(resource);
		AppConfig d = defaults();
		return new AppConfig(
				getInt(yaml, d.fps(), "playback", "fps"),
				getBoolean(yaml, d.bounceBack(), "playback", "bounceBack"),
				Duration.ofSeconds(getInt(yaml, (int) d.frameInterval().getSeconds(), "source", "frameIntervalSeconds")),
				getPlanet(yaml, d.planet()),
				getEnum(yaml, ProjectionType.class, d.projectionType(), "projection", "type"),
				getInt(yaml, d.pollIntervalMs(), "worker", "pollIntervalMs"));
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> loadYamlResource(String resource)
	{
		try (InputStream in = AppConfig.class.getResourceAsStream(resource))
		{
			if (in == null)
			{
				logger.warn("Configuration {} not found, using defaults", resource);
				return new HashMap<>();
			}
			Object loaded = new Yaml().load(in);
			if (loaded instanceof Map)
			{
				return (Map<String, Object>) loaded;
			}
			logger.warn("Configuration {} is not a mapping, using defaults", resource);
		}
		catch (IOException | YAMLException e)
		{
			logger.warn("Cannot read configuration {}, using defaults", resource, e);
		}
		return new HashMap<>();
	}

	@SuppressWarnings("unchecked")
	private static Object getValue(Map<String, Object> yaml, String... keys)
	{
		Object current = yaml;
		for (String key : keys)
		{
			if (!(current instanceof Map)) return null;
			current = ((Map<String, Object>) current).get(key);
		}
		return current;
	}

	private static int getInt(Map<String, Object> yaml, int fallback, String... keys)
	{
		Object value = getValue(yaml, keys);
		if (value instanceof Number n && n.intValue() > 0)
		{
			return n.intValue();
		}
		warnFallback(value, fallback, keys);
		return fallback;
	}

	private static boolean getBoolean(Map<String, Object> yaml, boolean fallback, String... keys)
	{
		Object value = getValue(yaml, keys);
		if (value instanceof Boolean b)
		{
			return b;
		}
		warnFallback(value, fallback, keys);
		return fallback;
	}

	private static <E extends Enum<E>> E getEnum(Map<String, Object> yaml, Class<E> type, E fallback, String... keys)
	{
		Object value = getValue(yaml, keys);
		if (value != null)
		{
			try
			{
				return Enum.valueOf(type, value.toString().trim().toUpperCase());
			}
			catch (IllegalArgumentException e)
			{
				logger.warn("Unknown {} '{}'", type.getSimpleName(), value);
			}
		}
		warnFallback(value, fallback, keys);
		return fallback;
	}

	private static Planet getPlanet(Map<String, Object> yaml, Planet fallback)
	{
		Object value = getValue(yaml, "source", "planet");
		if (value != null && "CUSTOM".equalsIgnoreCase(value.toString().trim()))
		{
			return null;
		}
		return getEnum(yaml, Planet.class, fallback, "source", "planet");
	}

	private static void warnFallback(Object value, Object fallback, String... keys)
	{
		String path = String.join(".", keys);
		if (value == null)
		{
			logger.warn("Configuration key {} missing, using {}", path, fallback);
		}
		else
		{
			logger.warn("Invalid value '{}' for {}, using {}", value, path, fallback);
		}
	}
}
