package dev.cpputest.adapter.process;

import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;

final class SpawnedProcess extends LaunchedProcess {
	private static final Logger log = LoggerFactory.getLogger(SpawnedProcess.class);

	SpawnedProcess(Process process) {
		this.process = process;
	}

	private final Process process;

	Process process() {
		return process;
	}

	@Override
	public long pid() {
		return process.pid();
	}

	@Override
	public boolean hasExited() {
		return !process.isAlive();
	}

	@Override
	public OptionalInt exitCode() {
		return hasExited() ? OptionalInt.of(process.exitValue()) : OptionalInt.empty();
	}

	@Override
	public void kill() {
		process.destroyForcibly();
	}

	@Override
	public void close() {
		IOUtils.closeQuietly(process.getOutputStream(), e -> log.debug("Failed to close stdin of process {}", pid(), e));
		IOUtils.closeQuietly(process.getInputStream(), e -> log.debug("Failed to close stdout of process {}", pid(), e));
		IOUtils.closeQuietly(process.getErrorStream(), e -> log.debug("Failed to close stderr of process {}", pid(), e));
	}
}
