package dev.cpputest.adapter;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public record TestResult(TestCase testCase, TestOutcome outcome, @Nullable String errorMessage) {
	public TestResult {
		Objects.requireNonNull(testCase, "testCase");
		Objects.requireNonNull(outcome, "outcome");
	}

	public static TestResult passed(TestCase testCase) {
		return new TestResult(testCase, TestOutcome.PASSED, null);
	}

	public static TestResult failed(TestCase testCase, String errorMessage) {
		return new TestResult(testCase, TestOutcome.FAILED, errorMessage);
	}
}
