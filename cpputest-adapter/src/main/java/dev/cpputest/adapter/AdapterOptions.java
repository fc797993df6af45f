package dev.cpputest.adapter;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings shared by discovery and execution.
 *
 * @param listArgument           argument that makes an executable print its test names.
 *                               Supported since CppUTest v3.7.
 * @param reportArgument         argument that makes an executable write JUnit XML reports.
 * @param reportGlob             pattern matching report files in the working directory.
 * @param discoveryTimeout       how long one executable may take to list its tests.
 * @param tempRoot               where per-run working directories are created.
 * @param keepWorkingDirectories leave working directories in place after a run.
 */
public record AdapterOptions(
	String listArgument,
	String reportArgument,
	String reportGlob,
	Duration discoveryTimeout,
	Path tempRoot,
	boolean keepWorkingDirectories
) {
	public static final String PROPERTY_PREFIX = "cpputest.";

	public AdapterOptions {
		Objects.requireNonNull(listArgument, "listArgument");
		Objects.requireNonNull(reportArgument, "reportArgument");
		Objects.requireNonNull(reportGlob, "reportGlob");
		Objects.requireNonNull(discoveryTimeout, "discoveryTimeout");
		Objects.requireNonNull(tempRoot, "tempRoot");
		if(discoveryTimeout.isNegative() || discoveryTimeout.isZero()) {
			throw new IllegalArgumentException("Discovery timeout must be positive: " + discoveryTimeout);
		}
	}

	public static AdapterOptions defaults() {
		return new AdapterOptions(
			"-ln",
			"-ojunit",
			"*.xml",
			Duration.ofMillis(5000),
			Path.of(System.getProperty("java.io.tmpdir")),
			false
		);
	}

	public static AdapterOptions fromSystemProperties() {
		return fromProperties(System.getProperties());
	}

	public static AdapterOptions fromProperties(Properties properties) {
		var defaults = defaults();

		var discoveryTimeout = defaults.discoveryTimeout();
		var timeoutStr = properties.getProperty(PROPERTY_PREFIX + "discoveryTimeoutMs");
		if(timeoutStr != null) {
			discoveryTimeout = Duration.ofMillis(parseMillis(PROPERTY_PREFIX + "discoveryTimeoutMs", timeoutStr));
		}

		var tempRoot = defaults.tempRoot();
		var tempDirStr = properties.getProperty(PROPERTY_PREFIX + "tempDir");
		if(tempDirStr != null && !tempDirStr.isBlank()) {
			tempRoot = Path.of(tempDirStr);
		}

		return new AdapterOptions(
			properties.getProperty(PROPERTY_PREFIX + "listArgument", defaults.listArgument()),
			properties.getProperty(PROPERTY_PREFIX + "reportArgument", defaults.reportArgument()),
			defaults.reportGlob(),
			discoveryTimeout,
			tempRoot,
			Boolean.parseBoolean(properties.getProperty(PROPERTY_PREFIX + "keepWorkingDirectories", "false"))
		);
	}

	private static long parseMillis(String name, String value) {
		try {
			return Long.parseLong(value.trim());
		}
		catch(NumberFormatException e) {
			throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
		}
	}

	public AdapterOptions withDiscoveryTimeout(Duration discoveryTimeout) {
		return new AdapterOptions(listArgument, reportArgument, reportGlob, discoveryTimeout, tempRoot, keepWorkingDirectories);
	}

	public AdapterOptions withTempRoot(Path tempRoot) {
		return new AdapterOptions(listArgument, reportArgument, reportGlob, discoveryTimeout, tempRoot, keepWorkingDirectories);
	}

	public AdapterOptions withKeepWorkingDirectories(boolean keepWorkingDirectories) {
		return new AdapterOptions(listArgument, reportArgument, reportGlob, discoveryTimeout, tempRoot, keepWorkingDirectories);
	}
}
