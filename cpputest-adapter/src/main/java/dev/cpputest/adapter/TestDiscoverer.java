package dev.cpputest.adapter;

import dev.cpputest.adapter.host.MessageLevel;
import dev.cpputest.adapter.host.MessageLogger;
import dev.cpputest.adapter.process.CancelSignal;
import dev.cpputest.adapter.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * Learns which test cases a CppUTest executable contains by asking it to list them.
 */
public final class TestDiscoverer {
	private static final Logger log = LoggerFactory.getLogger(TestDiscoverer.class);

	public TestDiscoverer(AdapterOptions options, SignatureDetector detector, ProcessRunner processRunner) {
		this.options = options;
		this.detector = detector;
		this.processRunner = processRunner;
	}

	public TestDiscoverer(AdapterOptions options) {
		this(options, new SignatureDetector(), new ProcessRunner());
	}

	private final AdapterOptions options;
	private final SignatureDetector detector;
	private final ProcessRunner processRunner;

	/**
	 * Discovers the tests of each CppUTest executable among the sources, each under its own
	 * discovery timeout. Sources that are not CppUTest executables are skipped, and a failure in
	 * one source is reported to the logger without affecting the others.
	 */
	public void discoverTests(Collection<Path> sources, MessageLogger logger, Consumer<TestCase> sink) throws InterruptedException {
		for(var source : sources) {
			try {
				if(!detector.isCompatible(source)) {
					log.debug("Skipping {}, not a CppUTest executable", source);
					continue;
				}

				try(var signal = new CancelSignal().cancelAfterTimeout(options.discoveryTimeout())) {
					discoverTests(source, logger, sink, signal);
				}
			}
			catch(IOException | RuntimeException e) {
				logger.sendMessage(MessageLevel.ERROR, "Error discovering tests in " + source.getFileName() + " - " + e);
			}
		}
	}

	/**
	 * Discovers the tests of one CppUTest executable. Either every listed test is passed to the sink
	 * or, if any name cannot be parsed, none is.
	 *
	 * @throws InvalidTestNameException if the executable lists a name that is not {@code Group.Case}.
	 * @throws java.util.concurrent.CancellationException if the signal fires first.
	 */
	public void discoverTests(Path source, MessageLogger logger, Consumer<TestCase> sink, CancelSignal signal) throws IOException, InterruptedException {
		var executableName = source.getFileName().toString();

		String output = processRunner.runAndCollectOutput(source, source.toAbsolutePath().getParent(), List.of(options.listArgument()), signal);

		var testCases = parseTestCases(source, output);
		if(testCases.isEmpty()) {
			logger.sendMessage(MessageLevel.INFORMATIONAL, "No tests found in " + executableName);
			return;
		}

		for(var testCase : testCases) {
			sink.accept(testCase);
		}

		logger.sendMessage(MessageLevel.INFORMATIONAL, "Discovered " + testCases.size() + " tests in " + executableName);
	}

	static List<TestCase> parseTestCases(Path source, String output) throws InvalidTestNameException {
		var trimmed = output.strip();
		if(trimmed.isEmpty()) {
			return List.of();
		}

		var testCases = new ArrayList<TestCase>();
		for(var name : trimmed.split("\\s+")) {
			TestIdentifier identifier;
			try {
				identifier = TestIdentifier.parse(name);
			}
			catch(InvalidTestNameException e) {
				throw new InvalidTestNameException(name, source.getFileName().toString(), e);
			}

			testCases.add(new TestCase(identifier, source));
		}
		return testCases;
	}
}
