package org.springaicommunity.github.harvester;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvBuilder;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the harvester's credentials and default identity from {@code .env} files and
 * the environment.
 *
 * <p>
 * Sources are searched in order and the first non-blank value wins:
 * <ol>
 * <li>{@code .env} file in the current working directory, then the system
 * environment</li>
 * <li>{@code .env} file in the user's home directory</li>
 * </ol>
 * Both files are optional and loaded once per process. Values are trimmed.
 */
public final class EnvironmentSupport {

	/**
	 * Variable holding the GitHub token.
	 */
	public static final String GITHUB_TOKEN = "GITHUB_TOKEN";

	/**
	 * Variable holding the username harvested by default.
	 */
	public static final String GITHUB_USERNAME = "GITHUB_USERNAME";

	static final String TOKEN_HINT = "Please set your GitHub personal access token: export GITHUB_TOKEN=your_token_here "
			+ "or add it to a .env file in the working or home directory";

	private static final List<Dotenv> SOURCES = defaultSources();

	private EnvironmentSupport() {
	}

	private static List<Dotenv> defaultSources() {
		List<Dotenv> sources = new ArrayList<>(2);
		sources.add(load(null));
		String home = System.getProperty("user.home");
		if (home != null) {
			sources.add(load(home));
		}
		return List.copyOf(sources);
	}

	/**
	 * Load the {@code .env} file of a directory, merged with the system environment.
	 * @param directory the directory holding the file, null for the working directory
	 * @return the loaded variables, only the system environment if the file is missing
	 */
	static Dotenv load(@Nullable String directory) {
		DotenvBuilder config = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed();
		if (directory != null) {
			config = config.directory(directory);
		}
		return config.load();
	}

	/**
	 * Get a variable, blank values counting as absent.
	 * @param name the variable name
	 * @return the trimmed value, or {@code null} if not set
	 */
	@Nullable
	public static String get(String name) {
		return lookup(name, SOURCES);
	}

	@Nullable
	static String lookup(String name, List<Dotenv> sources) {
		for (Dotenv source : sources) {
			String value = source.get(name);
			if (value != null && !value.isBlank()) {
				return value.trim();
			}
		}
		return null;
	}

	/**
	 * Get a variable that must be set.
	 * @param name the variable name
	 * @param hint how to provide it, appended to the error message
	 * @return the trimmed value
	 * @throws IllegalStateException if the variable is not set in any source
	 */
	public static String require(String name, String hint) {
		return require(name, hint, SOURCES);
	}

	static String require(String name, String hint, List<Dotenv> sources) {
		String value = lookup(name, sources);
		if (value == null) {
			throw new IllegalStateException(name + " environment variable is required. " + hint);
		}
		return value;
	}

	/**
	 * Get the GitHub token every harvest authenticates with.
	 * @return the token
	 * @throws IllegalStateException if {@code GITHUB_TOKEN} is not set
	 */
	public static String requireToken() {
		return require(GITHUB_TOKEN, TOKEN_HINT);
	}

	@Nullable
	public static String githubUsername() {
		return get(GITHUB_USERNAME);
	}

}
