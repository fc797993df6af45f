package dev.cpputest.adapter;

import dev.cpputest.adapter.host.DebuggerLauncher;
import dev.cpputest.adapter.host.FrameworkHandle;
import dev.cpputest.adapter.host.MessageLevel;
import dev.cpputest.adapter.process.CancelSignal;
import dev.cpputest.adapter.process.ProcessRunner;
import dev.cpputest.adapter.report.JUnitReportReader;
import org.apache.commons.io.file.PathUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Runs CppUTest executables and reports the outcome of each of their test cases.
 * <p>
 * Each executable is run once, in a fresh working directory, with its JUnit output enabled. The
 * reports it leaves there are matched against the cases that were asked for; any case without a
 * result is reported as skipped.
 */
public final class TestExecutor {
	private static final Logger log = LoggerFactory.getLogger(TestExecutor.class);

	public TestExecutor(
		AdapterOptions options,
		SignatureDetector detector,
		TestDiscoverer discoverer,
		ProcessRunner processRunner,
		JUnitReportReader reportReader
	) {
		this.options = options;
		this.detector = detector;
		this.discoverer = discoverer;
		this.processRunner = processRunner;
		this.reportReader = reportReader;
	}

	public TestExecutor(AdapterOptions options) {
		this(options, new SignatureDetector(), new ProcessRunner(), new JUnitReportReader());
	}

	private TestExecutor(AdapterOptions options, SignatureDetector detector, ProcessRunner processRunner, JUnitReportReader reportReader) {
		this(options, detector, new TestDiscoverer(options, detector, processRunner), processRunner, reportReader);
	}

	private final AdapterOptions options;
	private final SignatureDetector detector;
	private final TestDiscoverer discoverer;
	private final ProcessRunner processRunner;
	private final JUnitReportReader reportReader;

	/**
	 * Discovers and runs every test in the given executables. Files that are not CppUTest executables
	 * are ignored.
	 */
	public void runSources(
		Collection<Path> sources,
		FrameworkHandle handle,
		@Nullable DebuggerLauncher debuggerLauncher,
		CancelSignal signal
	) throws TestRunException, InterruptedException {
		var failures = new ArrayList<TestRunException>();
		var testCases = new ArrayList<TestCase>();

		for(var source : sources) {
			if(signal.isCancellationRequested()) {
				break;
			}

			try {
				if(!detector.isCompatible(source)) {
					log.debug("Skipping {}, not a CppUTest executable", source);
					continue;
				}

				discoverer.discoverTests(source, handle, testCases::add, signal);
			}
			catch(CancellationException e) {
				log.debug("Discovery of {} cancelled", source);
				break;
			}
			catch(IOException | RuntimeException e) {
				handle.sendMessage(MessageLevel.ERROR, "Error discovering tests in " + source.getFileName() + " - " + e);
				failures.add(new TestRunException(source, e));
			}
		}

		runTests(testCases, handle, debuggerLauncher, signal, failures);
		throwIfFailed(failures);
	}

	/**
	 * Runs the given test cases, which might be from different executables. A failure while running
	 * one executable does not stop the others; once all have run, the first failure is thrown with
	 * any later ones attached as suppressed exceptions. Executables not yet started when the signal
	 * fires are not run at all.
	 */
	public void runTests(
		Collection<TestCase> testCases,
		FrameworkHandle handle,
		@Nullable DebuggerLauncher debuggerLauncher,
		CancelSignal signal
	) throws TestRunException, InterruptedException {
		var failures = new ArrayList<TestRunException>();
		runTests(testCases, handle, debuggerLauncher, signal, failures);
		throwIfFailed(failures);
	}

	private void runTests(
		Collection<TestCase> testCases,
		FrameworkHandle handle,
		@Nullable DebuggerLauncher debuggerLauncher,
		CancelSignal signal,
		List<TestRunException> failures
	) throws InterruptedException {
		for(var entry : groupBySource(testCases).entrySet()) {
			var source = entry.getKey();
			if(signal.isCancellationRequested()) {
				log.debug("Run cancelled before {} was started", source);
				break;
			}

			try {
				runSource(source, entry.getValue(), handle, debuggerLauncher, signal);
			}
			catch(IOException | UnknownTestCaseException | RuntimeException e) {
				handle.sendMessage(MessageLevel.ERROR, "Error running tests in " + source.getFileName() + " - " + e);
				failures.add(new TestRunException(source, e));
			}
		}
	}

	/**
	 * Runs one executable and reports results for the given cases, all of which must belong to it.
	 * Every case is started before the executable is launched and ended exactly once, even if this
	 * method throws.
	 *
	 * @throws UnknownTestCaseException if a report names a case that was not asked for.
	 */
	public void runSource(
		Path source,
		Collection<TestCase> testCases,
		FrameworkHandle handle,
		@Nullable DebuggerLauncher debuggerLauncher,
		CancelSignal signal
	) throws IOException, UnknownTestCaseException, InterruptedException {
		var casesById = new LinkedHashMap<TestIdentifier, TestCase>();
		for(var testCase : testCases) {
			if(!testCase.source().equals(source)) {
				throw new IllegalArgumentException(testCase + " does not belong to " + source);
			}
			casesById.putIfAbsent(testCase.identifier(), testCase);
		}

		var pending = new LinkedHashSet<>(casesById.values());
		for(var testCase : pending) {
			handle.recordStart(testCase);
		}

		try {
			var workingDirectory = createWorkingDirectory();
			try {
				var exit = processRunner.run(source, workingDirectory, List.of(options.reportArgument()), debuggerLauncher, signal);
				if(exit.cancelled()) {
					log.debug("Run of {} was cancelled, collecting whatever it reported", source);
				}

				for(var report : listReports(workingDirectory)) {
					List<JUnitReportReader.ReportedTestCase> rows;
					try {
						rows = reportReader.read(report);
					}
					catch(IOException e) {
						if(!exit.cancelled()) {
							throw e;
						}

						// A killed process may have been in the middle of writing this report.
						handle.sendMessage(MessageLevel.WARNING, "Ignoring unreadable report " + report.getFileName() + " of cancelled run of " + source.getFileName() + " - " + e);
						break;
					}

					for(var row : rows) {
						var testCase = casesById.get(row.identifier());
						if(testCase == null) {
							throw new UnknownTestCaseException(row.identifier(), report);
						}

						if(!pending.remove(testCase)) {
							handle.sendMessage(MessageLevel.WARNING, "Ignoring repeated result for " + testCase.fullyQualifiedName() + " in " + report.getFileName());
							continue;
						}

						handle.recordResult(JUnitReportReader.toResult(testCase, row.row()));
					}
				}
			}
			finally {
				cleanUp(source, workingDirectory, handle);
			}
		}
		finally {
			for(var testCase : pending) {
				handle.recordEnd(testCase, TestOutcome.SKIPPED);
			}
		}
	}

	private static Map<Path, List<TestCase>> groupBySource(Collection<TestCase> testCases) {
		var bySource = new LinkedHashMap<Path, List<TestCase>>();
		for(var testCase : testCases) {
			bySource.computeIfAbsent(testCase.source(), source -> new ArrayList<>()).add(testCase);
		}
		return bySource;
	}

	private Path createWorkingDirectory() throws IOException {
		Files.createDirectories(options.tempRoot());
		return Files.createDirectory(options.tempRoot().resolve("cpputest-" + UUID.randomUUID()));
	}

	private List<Path> listReports(Path workingDirectory) throws IOException {
		var reports = new ArrayList<Path>();
		try(var dirStream = Files.newDirectoryStream(workingDirectory, options.reportGlob())) {
			for(var report : dirStream) {
				if(Files.isRegularFile(report)) {
					reports.add(report);
				}
			}
		}
		reports.sort(null);
		return reports;
	}

	private void cleanUp(Path source, Path workingDirectory, FrameworkHandle handle) {
		if(options.keepWorkingDirectories()) {
			handle.sendMessage(MessageLevel.INFORMATIONAL, "Kept working directory " + workingDirectory + " of " + source.getFileName());
			return;
		}

		try {
			PathUtils.deleteDirectory(workingDirectory);
		}
		catch(IOException e) {
			handle.sendMessage(MessageLevel.ERROR, "Failed to delete temp directory " + workingDirectory + " after running tests for " + source + " - " + e);
		}
	}

	private static void throwIfFailed(List<TestRunException> failures) throws TestRunException {
		if(failures.isEmpty()) {
			return;
		}

		var first = failures.get(0);
		for(var failure : failures.subList(1, failures.size())) {
			first.addSuppressed(failure);
		}
		throw first;
	}
}
