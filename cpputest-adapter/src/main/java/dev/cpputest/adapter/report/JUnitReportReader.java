package dev.cpputest.adapter.report;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import dev.cpputest.adapter.TestCase;
import dev.cpputest.adapter.TestIdentifier;
import dev.cpputest.adapter.TestResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JUnit XML reports written by CppUTest's {@code -ojunit} option.
 */
public final class JUnitReportReader {

	public static final String DEFAULT_FAILURE_MESSAGE = "Test failed.";

	public JUnitReportReader() {
		mapper = new XmlMapper();
		mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

		// <failure/> with nothing in it is still a failure.
		mapper.coercionConfigFor(FailureReport.class)
			.setAcceptBlankAsEmpty(true)
			.setCoercion(CoercionInputShape.EmptyString, CoercionAction.AsEmpty);
	}

	private final XmlMapper mapper;

	public List<ReportedTestCase> read(Path report) throws IOException {
		var suite = mapper.readValue(report.toFile(), TestSuiteReport.class);

		var rows = new ArrayList<ReportedTestCase>(suite.getTestCases().size());
		for(var row : suite.getTestCases()) {
			if(isEmpty(row.getClassName()) || isEmpty(row.getName())) {
				throw new ReportFormatException("Report " + report.getFileName() + " contains a testcase without classname or name: " + row);
			}

			rows.add(new ReportedTestCase(new TestIdentifier(row.getClassName(), row.getName()), row));
		}
		return rows;
	}

	public static TestResult toResult(TestCase testCase, TestCaseReport row) {
		var failure = row.getFailure();
		if(failure == null) {
			return TestResult.passed(testCase);
		}

		return TestResult.failed(testCase, failureMessage(row, failure));
	}

	static String failureMessage(TestCaseReport row, FailureReport failure) {
		var message = failure.getMessage() == null ? DEFAULT_FAILURE_MESSAGE : failure.getMessage();

		var file = row.getFile();
		if(isEmpty(file)) {
			return message;
		}

		var line = row.getLine();
		String prefix = isEmpty(line)
			? "In " + file
			: "At line " + line + " of " + file;

		return prefix + "\n\n" + message;
	}

	private static boolean isEmpty(String s) {
		return s == null || s.isEmpty();
	}

	public record ReportedTestCase(TestIdentifier identifier, TestCaseReport row) {
	}
}
