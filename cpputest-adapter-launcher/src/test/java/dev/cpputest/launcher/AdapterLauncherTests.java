package dev.cpputest.launcher;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

@EnabledOnOs({ OS.LINUX, OS.MAC })
public class AdapterLauncherTests {

	@TempDir
	Path tempDir;

	private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
	private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

	private Path writeExecutable(String name, String failureMessage) throws Exception {
		var failure = failureMessage == null ? "" : "<failure message=\"" + failureMessage + "\" type=\"AssertionFailedError\"/>";
		var script = "#!/bin/sh\n" +
			"# Thanks for using CppUTest.\n" +
			"case \"$1\" in\n" +
			"-ln) echo 'G.A G.B' ;;\n" +
			"-ojunit) cat > cpputest_G.xml <<'REPORT_EOF'\n" +
			"<?xml version=\"1.0\" encoding=\"UTF-8\" ?>\n" +
			"<testsuite name=\"G\" tests=\"2\">\n" +
			"<testcase classname=\"G\" name=\"B\" file=\"G.cpp\" line=\"7\">" + failure + "</testcase>\n" +
			"<testcase classname=\"G\" name=\"A\" file=\"G.cpp\" line=\"3\"></testcase>\n" +
			"</testsuite>\n" +
			"REPORT_EOF\n" +
			";;\n" +
			"esac\n";

		var path = tempDir.resolve(name);
		Files.writeString(path, script, StandardCharsets.UTF_8);
		Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rwxr-xr-x"));
		return path;
	}

	private LauncherArgs args(Path... executables) {
		var args = new LauncherArgs();
		args.executables = List.of(executables);
		args.tempDir = tempDir.resolve("work");
		return args;
	}

	private String output() {
		return buffer.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
	}

	@Test
	void listsDiscoveredTests() throws Exception {
		var args = args(writeExecutable("AllTests", null));
		args.listOnly = true;

		Assertions.assertEquals(AdapterLauncher.EXIT_OK, AdapterLauncher.run(args, out));
		Assertions.assertEquals("G.A\nG.B\n", output());
	}

	@Test
	void passingRunExitsCleanly() throws Exception {
		Assertions.assertEquals(AdapterLauncher.EXIT_OK, AdapterLauncher.run(args(writeExecutable("AllTests", null)), out));
		Assertions.assertTrue(output().endsWith("Finished: 2 passed, 0 failed, 0 skipped\n"), output());
	}

	@Test
	void failingTestSetsExitCode() throws Exception {
		Assertions.assertEquals(AdapterLauncher.EXIT_FAILED, AdapterLauncher.run(args(writeExecutable("AllTests", "nope")), out));
		Assertions.assertTrue(output().contains("[FAILED] G.B (AllTests)\n    At line 7 of G.cpp\n    \n    nope\n"), output());
	}

	@Test
	void nonCppUTestFilesAreIgnored() throws Exception {
		var other = tempDir.resolve("notes.txt");
		Files.writeString(other, "nothing to see", StandardCharsets.UTF_8);

		Assertions.assertEquals(AdapterLauncher.EXIT_OK, AdapterLauncher.run(args(other), out));
		Assertions.assertEquals("Finished: 0 passed, 0 failed, 0 skipped\n", output());
	}

	@Test
	void terminatingLauncherKillsRunningExecutable() throws Exception {
		var pidFile = tempDir.resolve("pid.txt");
		var exe = tempDir.resolve("Hangs");
		Files.writeString(exe,
			"#!/bin/sh\n" +
			"# Thanks for using CppUTest.\n" +
			"case \"$1\" in\n" +
			"-ln) echo 'G.A G.B' ;;\n" +
			"-ojunit) echo $$ > '" + pidFile + ".tmp'\n" +
			"mv '" + pidFile + ".tmp' '" + pidFile + "'\n" +
			"exec sleep 30 ;;\n" +
			"esac\n",
			StandardCharsets.UTF_8
		);
		Files.setPosixFilePermissions(exe, PosixFilePermissions.fromString("rwxr-xr-x"));

		var launcherOutput = tempDir.resolve("launcher.out");
		var java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
		var launcher = new ProcessBuilder(
			java, "-cp", System.getProperty("java.class.path"),
			AdapterLauncher.class.getName(),
			"--temp-dir", tempDir.resolve("work").toString(),
			exe.toString()
		)
			.redirectErrorStream(true)
			.redirectOutput(launcherOutput.toFile())
			.start();

		try {
			long deadline = System.nanoTime() + Duration.ofSeconds(30).toNanos();
			while(Files.notExists(pidFile)) {
				Assertions.assertTrue(launcher.isAlive(), () -> "launcher exited early: " + readQuietly(launcherOutput));
				Assertions.assertTrue(System.nanoTime() < deadline, "executable was never started");
				Thread.sleep(20);
			}
			long pid = Long.parseLong(Files.readString(pidFile).trim());

			launcher.destroy();
			Assertions.assertTrue(launcher.waitFor(20, TimeUnit.SECONDS), "launcher did not exit");

			awaitDeath(pid);
			var output = Files.readString(launcherOutput, StandardCharsets.UTF_8);
			Assertions.assertTrue(output.contains("[SKIPPED] G.A (Hangs)"), output);
			Assertions.assertTrue(output.contains("[SKIPPED] G.B (Hangs)"), output);
		}
		finally {
			launcher.destroyForcibly();
		}
	}

	private static void awaitDeath(long pid) throws InterruptedException {
		long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
		while(System.nanoTime() < deadline) {
			var handle = ProcessHandle.of(pid);
			if(handle.isEmpty() || !handle.get().isAlive()) {
				return;
			}
			Thread.sleep(10);
		}
		Assertions.fail("Process " + pid + " is still alive");
	}

	private static String readQuietly(Path path) {
		try {
			return Files.readString(path, StandardCharsets.UTF_8);
		}
		catch(Exception e) {
			return "<" + e + ">";
		}
	}
}
