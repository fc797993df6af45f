package dev.cpputest.adapter;

import java.nio.file.Path;

/**
 * A report named a test that was not part of the requested run for its executable.
 */
public class UnknownTestCaseException extends Exception {
	public UnknownTestCaseException(TestIdentifier identifier, Path report) {
		super("Report " + report.getFileName() + " contains a result for " + identifier.fullyQualifiedName() + ", which was not requested");
		this.identifier = identifier;
	}

	private final TestIdentifier identifier;

	public TestIdentifier getIdentifier() {
		return identifier;
	}
}
