package dev.cpputest.adapter;

import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Recognizes CppUTest executables by a marker string compiled into them.
 */
public final class SignatureDetector {

	// Added to CppUTest in bdec98d5e6170e4888c593e71276e46add633f0a, first released in v4.0.
	public static final String CPPUTEST_SIGNATURE = "Thanks for using CppUTest.";

	public static final int DEFAULT_CHUNK_SIZE = 4096;

	public SignatureDetector() {
		this(CPPUTEST_SIGNATURE.getBytes(StandardCharsets.US_ASCII), DEFAULT_CHUNK_SIZE);
	}

	public SignatureDetector(byte[] signature, int chunkSize) {
		if(signature.length == 0) {
			throw new IllegalArgumentException("Signature must not be empty");
		}
		if(chunkSize <= 0) {
			throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
		}

		this.signature = signature.clone();
		this.chunkSize = chunkSize;
	}

	private final byte[] signature;
	private final int chunkSize;

	/**
	 * Determines whether the given file is most likely a CppUTest test executable.
	 */
	public boolean isCompatible(Path file) throws IOException {
		int overlap = signature.length - 1;
		var buffer = new byte[overlap + chunkSize];
		int carried = 0;

		try(var in = Files.newInputStream(file)) {
			while(true) {
				int count = IOUtils.read(in, buffer, carried, chunkSize);
				if(count == 0) {
					return false;
				}

				int length = carried + count;
				if(contains(buffer, length)) {
					return true;
				}

				// Keep the tail so a signature split across two reads is still seen whole.
				carried = Math.min(overlap, length);
				System.arraycopy(buffer, length - carried, buffer, 0, carried);
			}
		}
	}

	private boolean contains(byte[] buffer, int length) {
		for(int i = 0; i + signature.length <= length; i++) {
			int j = 0;
			while(j < signature.length && buffer[i + j] == signature[j]) {
				j++;
			}

			if(j == signature.length) {
				return true;
			}
		}

		return false;
	}
}
