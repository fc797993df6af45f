package dev.cpputest.launcher;

import dev.cpputest.adapter.TestCase;
import dev.cpputest.adapter.TestOutcome;
import dev.cpputest.adapter.TestResult;
import dev.cpputest.adapter.host.FrameworkHandle;
import dev.cpputest.adapter.host.MessageLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prints run events to a console stream and counts outcomes. Host messages go to the log.
 */
final class ConsoleFrameworkHandle implements FrameworkHandle {
	private static final Logger log = LoggerFactory.getLogger(ConsoleFrameworkHandle.class);

	public ConsoleFrameworkHandle(PrintStream out) {
		this.out = out;
	}

	private final PrintStream out;
	private final AtomicInteger passed = new AtomicInteger();
	private final AtomicInteger failed = new AtomicInteger();
	private final AtomicInteger skipped = new AtomicInteger();
	private final AtomicInteger errors = new AtomicInteger();

	@Override
	public void recordStart(TestCase testCase) {
		print("START", testCase);
	}

	@Override
	public void recordEnd(TestCase testCase, TestOutcome outcome) {
		count(outcome);
		print(outcome.name(), testCase);
	}

	@Override
	public void recordResult(TestResult result) {
		count(result.outcome());
		synchronized(out) {
			print(result.outcome().name(), result.testCase());
			if(result.errorMessage() != null) {
				for(var line : result.errorMessage().split("\n", -1)) {
					out.println("    " + line);
				}
			}
		}
	}

	@Override
	public void sendMessage(MessageLevel level, String message) {
		switch(level) {
			case INFORMATIONAL -> log.info(message);
			case WARNING -> log.warn(message);
			case ERROR -> {
				errors.incrementAndGet();
				log.error(message);
			}
		}
	}

	public int passedCount() {
		return passed.get();
	}

	public int failedCount() {
		return failed.get();
	}

	public int skippedCount() {
		return skipped.get();
	}

	public int errorCount() {
		return errors.get();
	}

	public boolean hasFailures() {
		return failed.get() > 0 || errors.get() > 0;
	}

	public String summary() {
		return passed.get() + " passed, " + failed.get() + " failed, " + skipped.get() + " skipped";
	}

	private void count(TestOutcome outcome) {
		switch(outcome) {
			case PASSED -> passed.incrementAndGet();
			case FAILED -> failed.incrementAndGet();
			case SKIPPED -> skipped.incrementAndGet();
		}
	}

	private void print(String event, TestCase testCase) {
		synchronized(out) {
			out.println("[" + event + "] " + testCase.fullyQualifiedName() + " (" + testCase.source().getFileName() + ")");
		}
	}
}
