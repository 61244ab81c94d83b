package org.javai.swan.testsupport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Access to the sample programs under {@code src/test/resources/programs}.
 */
public final class Fixtures {

	private Fixtures() {
		// Utility class - no instantiation
	}

	public static Path path(String name) {
		URL resource = Fixtures.class.getResource("/programs/" + name);
		if (resource == null) {
			throw new IllegalArgumentException("No such fixture: " + name);
		}
		try {
			return Path.of(resource.toURI());
		}
		catch (URISyntaxException e) {
			throw new IllegalStateException("Bad fixture location: " + resource, e);
		}
	}

	public static String read(String name) {
		try {
			return Files.readString(path(name), StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
