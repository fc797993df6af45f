package dev.cpputest.adapter;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

public class AdapterOptionsTests {

	@Test
	void defaultsMatchCppUTestArguments() {
		var options = AdapterOptions.defaults();
		Assertions.assertEquals("-ln", options.listArgument());
		Assertions.assertEquals("-ojunit", options.reportArgument());
		Assertions.assertEquals("*.xml", options.reportGlob());
		Assertions.assertEquals(Duration.ofSeconds(5), options.discoveryTimeout());
		Assertions.assertFalse(options.keepWorkingDirectories());
	}

	@Test
	void propertiesOverrideDefaults() {
		var properties = new Properties();
		properties.setProperty("cpputest.discoveryTimeoutMs", "250");
		properties.setProperty("cpputest.tempDir", "/var/tmp/cpputest");
		properties.setProperty("cpputest.keepWorkingDirectories", "true");
		properties.setProperty("cpputest.reportArgument", "-ojunit");

		var options = AdapterOptions.fromProperties(properties);
		Assertions.assertEquals(Duration.ofMillis(250), options.discoveryTimeout());
		Assertions.assertEquals(Path.of("/var/tmp/cpputest"), options.tempRoot());
		Assertions.assertTrue(options.keepWorkingDirectories());
		Assertions.assertEquals("-ln", options.listArgument());
	}

	@Test
	void rejectsInvalidTimeout() {
		var properties = new Properties();
		properties.setProperty("cpputest.discoveryTimeoutMs", "soon");
		Assertions.assertThrows(IllegalArgumentException.class, () -> AdapterOptions.fromProperties(properties));

		properties.setProperty("cpputest.discoveryTimeoutMs", "0");
		Assertions.assertThrows(IllegalArgumentException.class, () -> AdapterOptions.fromProperties(properties));
	}

	@Test
	void withersReplaceOneSetting() {
		var options = AdapterOptions.defaults()
			.withKeepWorkingDirectories(true)
			.withDiscoveryTimeout(Duration.ofSeconds(1));

		Assertions.assertTrue(options.keepWorkingDirectories());
		Assertions.assertEquals(Duration.ofSeconds(1), options.discoveryTimeout());
		Assertions.assertEquals("-ln", options.listArgument());
	}
}
