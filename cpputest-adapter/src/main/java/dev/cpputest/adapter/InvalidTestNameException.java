package dev.cpputest.adapter;

import java.io.IOException;

public class InvalidTestNameException extends IOException {
	public InvalidTestNameException(String testName) {
		super("Unsupported format of test name \"" + testName + "\"");
		this.testName = testName;
	}

	public InvalidTestNameException(String testName, String executableName, Throwable cause) {
		super("Unsupported format of test name \"" + testName + "\" reported by " + executableName, cause);
		this.testName = testName;
	}

	private final String testName;

	public String getTestName() {
		return testName;
	}
}
