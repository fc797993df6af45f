package dev.cpputest.launcher;

import com.beust.jcommander.*;

import java.nio.file.Path;
import java.util.List;

class LauncherArgs {

	@Parameter(names = { "-h", "--help" }, help = true)
	public boolean help = false;

	@Parameter(required = true, description = "<executable>...")
	public List<Path> executables;

	@Parameter(names = { "--list" }, description = "Only list the tests of each executable")
	public boolean listOnly = false;

	@Parameter(names = { "--discovery-timeout" }, description = "Milliseconds an executable may take to list its tests", validateWith = PositiveMillisValidator.class)
	public Long discoveryTimeoutMillis;

	@Parameter(names = { "--timeout" }, description = "Milliseconds after which the whole run is cancelled", validateWith = PositiveMillisValidator.class)
	public Long timeoutMillis;

	@Parameter(names = { "--keep" }, description = "Keep working directories")
	public boolean keepWorkingDirectories = false;

	@Parameter(names = { "--temp-dir" }, description = "Directory in which working directories are created")
	public Path tempDir;

	public static final class PositiveMillisValidator implements IParameterValidator {
		@Override
		public void validate(String name, String value) throws ParameterException {
			long millis;
			try {
				millis = Long.parseLong(value);
			}
			catch(NumberFormatException e) {
				throw new ParameterException(name + " must be a number of milliseconds: " + value);
			}

			if(millis <= 0) {
				throw new ParameterException(name + " must be positive: " + value);
			}
		}
	}
}
