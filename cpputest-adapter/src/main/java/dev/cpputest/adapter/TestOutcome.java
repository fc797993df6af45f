package dev.cpputest.adapter;

public enum TestOutcome {
	PASSED,
	FAILED,
	SKIPPED,
}
