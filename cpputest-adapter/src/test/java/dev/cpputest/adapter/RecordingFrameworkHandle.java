package dev.cpputest.adapter;

import dev.cpputest.adapter.host.FrameworkHandle;
import dev.cpputest.adapter.host.MessageLevel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class RecordingFrameworkHandle implements FrameworkHandle {

	public final List<String> records = Collections.synchronizedList(new ArrayList<>());
	public final List<String> messages = Collections.synchronizedList(new ArrayList<>());

	@Override
	public void recordStart(TestCase testCase) {
		records.add("RecordStart: " + testCase.source().getFileName() + " - " + testCase.fullyQualifiedName());
	}

	@Override
	public void recordEnd(TestCase testCase, TestOutcome outcome) {
		records.add("RecordEnd: " + testCase.source().getFileName() + " - " + testCase.fullyQualifiedName() + " - " + outcome);
	}

	@Override
	public void recordResult(TestResult result) {
		var testCase = result.testCase();
		records.add("RecordResult: " + testCase.source().getFileName() + " - " + testCase.fullyQualifiedName() + " - " + result.outcome() + " - " +
			(result.errorMessage() == null ? "" : result.errorMessage()));
	}

	@Override
	public void sendMessage(MessageLevel level, String message) {
		messages.add(level + ": " + message);
	}

	public List<String> recordsStartingWith(String prefix) {
		synchronized(records) {
			return records.stream().filter(r -> r.startsWith(prefix)).toList();
		}
	}
}
