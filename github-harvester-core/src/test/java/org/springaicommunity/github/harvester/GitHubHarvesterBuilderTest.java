package org.springaicommunity.github.harvester;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("GitHubHarvesterBuilder Tests")
@ExtendWith(MockitoExtension.class)
class GitHubHarvesterBuilderTest {

	@Mock
	private GitHubClient mockClient;

	@TempDir
	Path tempDir;

	private HarvestProperties properties() {
		HarvestProperties properties = new HarvestProperties();
		properties.setOutputDirectory(tempDir.toString());
		properties.setInitialRetryDelayMs(1);
		properties.setMaxRetryDelayMs(2);
		return properties;
	}

	@Test
	@DisplayName("Should require a token when no client is given")
	void shouldRequireToken() {
		assertThatThrownBy(() -> GitHubHarvesterBuilder.create().build()).isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("GitHub token is required");
		assertThatThrownBy(() -> GitHubHarvesterBuilder.create().token("  ").build())
			.isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("Should build with a token and default settings")
	void shouldBuildWithToken() {
		try (GitHubHarvester harvester = GitHubHarvesterBuilder.create().token("test-token").build()) {
			assertThat(harvester.getRateGovernor()).isNotNull();
			assertThat(harvester.getRateGovernor().snapshot()).isNull();
		}
	}

	@Test
	@DisplayName("Should wrap a custom client with the retry policy")
	void shouldRetryCustomClient() {
		GitHubApiException serverError = new GitHubApiException(FailureKind.TRANSIENT_NETWORK, "HTTP 502", 502, null);
		when(mockClient.get(anyString())).thenThrow(serverError)
			.thenReturn(GitHubFixtures.response("[{\"full_name\":\"octocat/fork\",\"name\":\"fork\",\"fork\":true}]"))
			.thenReturn(GitHubFixtures.response("{\"full_name\":\"octocat/fork\",\"name\":\"fork\",\"fork\":true}"));

		try (GitHubHarvester harvester = GitHubHarvesterBuilder.create()
			.httpClient(mockClient)
			.properties(properties())
			.build()) {
			HarvestResult result = harvester.harvest(FetchTarget.forks("octocat"));

			assertThat(result.isSuccessful()).isTrue();
			assertThat(result.recordCount()).isEqualTo(1);
		}
		verify(mockClient, times(2)).get("/users/octocat/repos?type=owner&per_page=100");
	}

	@Test
	@DisplayName("Should feed rate limit headers to the shared governor")
	void shouldObserveRateLimits() {
		when(mockClient.get(anyString())).thenReturn(GitHubFixtures.response("[]"));

		try (GitHubHarvester harvester = GitHubHarvesterBuilder.create()
			.httpClient(mockClient)
			.properties(properties())
			.build()) {
			harvester.harvest(FetchTarget.forks("octocat"));

			assertThat(harvester.getRateGovernor().snapshot()).isEqualTo(GitHubFixtures.PLENTY_OF_QUOTA);
		}
	}

	@Test
	@DisplayName("Should use the configured page size and export sink")
	void shouldUseConfiguredCollaborators() {
		HarvestProperties properties = properties();
		properties.setPerPage(30);
		List<Path> opened = new ArrayList<>();
		GzipCsvExportSink delegate = new GzipCsvExportSink();
		when(mockClient.get("/users/octocat/followers?per_page=30")).thenReturn(GitHubFixtures.response("[]"));

		try (GitHubHarvester harvester = GitHubHarvesterBuilder.create()
			.httpClient(mockClient)
			.properties(properties)
			.exportSink((path, header) -> {
				opened.add(path);
				return delegate.open(path, header);
			})
			.build()) {
			assertThat(harvester.harvest(FetchTarget.followers("octocat")).isSuccessful()).isTrue();
		}
		assertThat(opened).containsExactly(tempDir.resolve("github_followers_octocat.csv.gz.part"));
	}

	@Test
	@DisplayName("Should let a caller abandon a job created up front")
	void shouldAbandonCreatedJob() {
		try (GitHubHarvester harvester = GitHubHarvesterBuilder.create()
			.httpClient(mockClient)
			.properties(properties())
			.build()) {
			HarvestJob job = harvester.createJob(FetchTarget.contributors("acme/widgets"));
			job.abandon();

			HarvestResult result = harvester.harvest(job);

			assertThat(result.status()).isEqualTo(HarvestStatus.FAILED);
			assertThat(result.failureReason()).isEqualTo("abandoned");
		}
		verifyNoInteractions(mockClient);
	}

}
