package dev.cpputest.launcher;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import dev.cpputest.adapter.AdapterOptions;
import dev.cpputest.adapter.TestDiscoverer;
import dev.cpputest.adapter.TestExecutor;
import dev.cpputest.adapter.TestRunException;
import dev.cpputest.adapter.process.CancelSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class AdapterLauncher {
	private static final Logger log = LoggerFactory.getLogger(AdapterLauncher.class);

	static final int EXIT_OK = 0;
	static final int EXIT_FAILED = 1;
	static final int EXIT_USAGE = 2;

	static final Duration SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(10);

	public static void main(String[] args) throws InterruptedException {
		var launcherArgs = new LauncherArgs();
		var commander = JCommander.newBuilder()
			.programName("cpputest-adapter")
			.addObject(launcherArgs)
			.build();

		try {
			commander.parse(args);
		}
		catch(ParameterException e) {
			System.err.println(e.getMessage());
			commander.usage();
			System.exit(EXIT_USAGE);
		}

		if(launcherArgs.help) {
			commander.usage();
			return;
		}

		System.exit(run(launcherArgs, System.out));
	}

	static int run(LauncherArgs args, PrintStream out) throws InterruptedException {
		var options = toOptions(args);
		var handle = new ConsoleFrameworkHandle(out);

		if(args.listOnly) {
			new TestDiscoverer(options).discoverTests(args.executables, handle, testCase -> out.println(testCase.fullyQualifiedName()));
			return handle.errorCount() > 0 ? EXIT_FAILED : EXIT_OK;
		}

		boolean runFailed = false;
		try(var signal = new CancelSignal()) {
			if(args.timeoutMillis != null) {
				signal.cancelAfterTimeout(Duration.ofMillis(args.timeoutMillis));
			}

			var finished = new CountDownLatch(1);
			var hook = new Thread(() -> cancelOnShutdown(signal, finished), "cpputest-shutdown");
			Runtime.getRuntime().addShutdownHook(hook);
			try {
				try {
					new TestExecutor(options).runSources(args.executables, handle, null, signal);
				}
				catch(TestRunException e) {
					log.debug("Test run failed", e);
					runFailed = true;
				}

				if(signal.isCancellationRequested()) {
					out.println("Test run was cancelled");
				}
				out.println("Finished: " + handle.summary());
			}
			finally {
				removeShutdownHook(hook);
				finished.countDown();
			}
		}

		return runFailed || handle.hasFailures() ? EXIT_FAILED : EXIT_OK;
	}

	static AdapterOptions toOptions(LauncherArgs args) {
		var options = AdapterOptions.fromSystemProperties();
		if(args.discoveryTimeoutMillis != null) {
			options = options.withDiscoveryTimeout(Duration.ofMillis(args.discoveryTimeoutMillis));
		}
		if(args.tempDir != null) {
			options = options.withTempRoot(args.tempDir);
		}
		if(args.keepWorkingDirectories) {
			options = options.withKeepWorkingDirectories(true);
		}
		return options;
	}

	// The JVM halts once every hook returns, so wait for the run to kill its process and end its cases.
	private static void cancelOnShutdown(CancelSignal signal, CountDownLatch finished) {
		try {
			signal.cancel();
		}
		catch(IllegalStateException e) {
			log.debug("Run already finished at shutdown", e);
			return;
		}

		try {
			if(!finished.await(SHUTDOWN_GRACE_PERIOD.toMillis(), TimeUnit.MILLISECONDS)) {
				log.warn("Test run did not finish within {} of shutdown", SHUTDOWN_GRACE_PERIOD);
			}
		}
		catch(InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private static void removeShutdownHook(Thread hook) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		}
		catch(IllegalStateException e) {
			log.debug("JVM is shutting down, leaving the hook in place", e);
		}
	}
}
