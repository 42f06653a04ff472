package org.springaicommunity.github.harvester;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser of the harvester CLI. Pure Java, so it can be tested
 * without starting anything.
 */
public class ArgumentParser {

	private static final String NAME_PATTERN = "^[a-zA-Z0-9._-]+$";

	private final HarvestProperties defaultProperties;

	public ArgumentParser(HarvestProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-t", "--type":
					config.harvestKind = HarvestKind.fromId(getRequiredValue(args, i, "type"));
					i++;
					break;

				case "-u", "--user":
					config.user = getRequiredValue(args, i, "user").trim();
					i++;
					break;

				case "-r", "--repo":
					config.repository = getRequiredValue(args, i, "repository").trim();
					i++;
					break;

				case "-w", "--workers":
					config.workerCount = parsePositive(getRequiredValue(args, i, "workers"), "worker count");
					i++;
					break;

				case "--per-page":
					config.perPage = parsePositive(getRequiredValue(args, i, "per-page"), "page size");
					i++;
					break;

				case "-o", "--output-dir":
					config.outputDirectory = getRequiredValue(args, i, "output-dir");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}
		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-harvester [OPTIONS]\n");
		help.append("\n");
		help.append("Export the followers, repository contributors or forks of a GitHub account\n");
		help.append("to a gzip-compressed CSV file.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -t, --type <type>       What to harvest: followers, contributors, forks (default: followers)\n");
		help.append("    -u, --user <user>       User whose followers or forks are harvested (default: GITHUB_USERNAME)\n");
		help.append("    -r, --repo <repo>       Repository in format owner/repo (required for contributors)\n");
		help.append("    -w, --workers <count>   Concurrent requests (default: ")
			.append(defaultProperties.getWorkerCount())
			.append(")\n");
		help.append("    --per-page <size>       Records per API page, 1-100 (default: ")
			.append(defaultProperties.getPerPage())
			.append(")\n");
		help.append("    -o, --output-dir <dir>  Directory for the export (default: ")
			.append(defaultProperties.getOutputDirectory())
			.append(")\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES (also read from a .env file):\n");
		help.append("    GITHUB_TOKEN            GitHub personal access token (required)\n");
		help.append("    GITHUB_USERNAME         Default user for followers and forks\n");
		help.append("\n");
		help.append("OUTPUT:\n");
		help.append("    followers     github_followers_<user>.csv.gz\n");
		help.append("    contributors  github_repo_contributions_<owner>_<repo>.csv.gz\n");
		help.append("    forks         github_forks_<user>.csv.gz\n");
		help.append("    Each export is written next to a <name>.metadata.json summary.\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-harvester --type followers --user octocat\n");
		help.append("    github-harvester --type contributors --repo spring-projects/spring-ai --workers 4\n");
		help.append("    github-harvester --type forks --user octocat --output-dir data\n");
		help.append("\n");
		return help.toString();
	}

	/**
	 * Validate environment (GitHub token).
	 * @throws IllegalStateException if environment is invalid
	 */
	public void validateEnvironment() {
		EnvironmentSupport.requireToken();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parsePositive(String value, String what) {
		try {
			int parsed = Integer.parseInt(value);
			if (parsed <= 0) {
				throw new IllegalArgumentException("Invalid " + what + " '" + value + "': must be a positive integer");
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + what + " '" + value + "': must be a positive integer");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.harvestKind == HarvestKind.CONTRIBUTORS) {
			if (config.repository == null || config.repository.isEmpty()) {
				errors.add("Repository is required for contributors (use --repo owner/repo)");
			}
			else if (!config.repository.matches("^[a-zA-Z0-9._-]+/[a-zA-Z0-9._-]+$")) {
				errors.add("Repository must be in format 'owner/repo' (e.g., 'spring-projects/spring-ai')");
			}
		}
		else if (config.user == null || config.user.isEmpty()) {
			errors.add("User is required for " + config.harvestKind.id() + " (use --user or set GITHUB_USERNAME)");
		}
		else if (!config.user.matches(NAME_PATTERN)) {
			errors.add("Invalid user name: " + config.user);
		}

		if (config.workerCount > 100) {
			errors.add("Worker count too large (got: " + config.workerCount + ", max: 100)");
		}
		if (config.perPage > 100) {
			errors.add("Page size too large (got: " + config.perPage + ", max: 100)");
		}
		if (config.outputDirectory.isBlank()) {
			errors.add("Output directory cannot be empty");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
