package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	public HarvestKind harvestKind = HarvestKind.FOLLOWERS;

	// followers and forks
	public @Nullable String user;

	// contributors, "owner/repo"
	public @Nullable String repository;

	public int workerCount;

	public int perPage;

	public String outputDirectory;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(HarvestProperties defaultProperties) {
		this.user = defaultProperties.getDefaultUser();
		this.workerCount = defaultProperties.getWorkerCount();
		this.perPage = defaultProperties.getPerPage();
		this.outputDirectory = defaultProperties.getOutputDirectory();
	}

	/**
	 * Returns the listing target described by the arguments.
	 * @return the target
	 * @throws IllegalStateException if the user or repository the kind needs is missing
	 */
	public FetchTarget toFetchTarget() {
		switch (harvestKind) {
			case CONTRIBUTORS:
				return FetchTarget.contributors(require(repository, "repository"));
			case FORKS:
				return FetchTarget.forks(require(user, "user"));
			default:
				return FetchTarget.followers(require(user, "user"));
		}
	}

	/**
	 * Copy the command-line overrides onto harvest properties.
	 * @param properties the properties to update
	 * @return the same properties
	 */
	public HarvestProperties applyTo(HarvestProperties properties) {
		properties.setWorkerCount(workerCount);
		properties.setPerPage(perPage);
		properties.setOutputDirectory(outputDirectory);
		properties.setDefaultUser(user);
		return properties;
	}

	private String require(@Nullable String value, String name) {
		if (value == null) {
			throw new IllegalStateException("No " + name + " given for " + harvestKind.id());
		}
		return value;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "harvestKind=" + harvestKind + ", user='" + user + '\'' + ", repository='"
				+ repository + '\'' + ", workerCount=" + workerCount + ", perPage=" + perPage + ", outputDirectory='"
				+ outputDirectory + '\'' + ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}
