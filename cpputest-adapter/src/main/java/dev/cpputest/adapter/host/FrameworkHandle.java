package dev.cpputest.adapter.host;

import dev.cpputest.adapter.TestCase;
import dev.cpputest.adapter.TestOutcome;
import dev.cpputest.adapter.TestResult;

/**
 * Receives the progress of a test run.
 * <p>
 * Every case passed to {@link #recordStart(TestCase)} is later passed to exactly one of
 * {@link #recordResult(TestResult)} or {@link #recordEnd(TestCase, TestOutcome)}.
 */
public interface FrameworkHandle extends MessageLogger {
	void recordStart(TestCase testCase);

	void recordEnd(TestCase testCase, TestOutcome outcome);

	void recordResult(TestResult result);
}
