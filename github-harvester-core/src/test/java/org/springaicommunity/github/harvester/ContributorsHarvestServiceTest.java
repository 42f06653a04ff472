package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("ContributorsHarvestService Tests")
@ExtendWith(MockitoExtension.class)
class ContributorsHarvestServiceTest {

	private static final String REPOSITORY_PATH = "/repos/acme/widgets";

	private static final String FIRST_PAGE = "/repos/acme/widgets/contributors?per_page=100";

	@Mock
	private GitHubClient mockClient;

	private ParallelCrawler crawler;

	private ContributorsHarvestService service;

	@TempDir
	Path tempDir;

	@BeforeEach
	void setUp() {
		ObjectMapper objectMapper = ObjectMapperFactory.create();
		HarvestProperties properties = new HarvestProperties();
		properties.setOutputDirectory(tempDir.toString());
		crawler = new ParallelCrawler(new GitHubPageFetcher(mockClient, objectMapper, 100), 4);
		service = new ContributorsHarvestService(crawler, new GzipCsvExportSink(), new JsonNodeUtils(), objectMapper,
				properties);
	}

	@AfterEach
	void tearDown() {
		crawler.close();
	}

	private static String pageLink(int page) {
		return "https://api.github.com/repositories/1296269/contributors?per_page=100&page=" + page;
	}

	/**
	 * Five listing pages of two contributors each; the page numbered {@code failingPage}
	 * answers 404 (0 for none).
	 */
	private void stubPages(int failingPage) {
		when(mockClient.get(anyString())).thenAnswer(invocation -> {
			String path = invocation.getArgument(0);
			if (path.equals(REPOSITORY_PATH)) {
				return GitHubFixtures.response(GitHubFixtures.repository("acme/widgets"));
			}
			int page = path.equals(FIRST_PAGE) ? 1 : Integer.parseInt(path.substring(path.lastIndexOf('=') + 1));
			if (page == failingPage) {
				throw GitHubFixtures.notFound(path);
			}
			String body = GitHubFixtures.contributorList(page * 10, 2);
			return page < 5 ? GitHubFixtures.response(body, pageLink(page + 1)) : GitHubFixtures.response(body);
		});
	}

	@Test
	@DisplayName("Should export every contributor with the repository columns")
	void shouldExportContributors() throws Exception {
		stubPages(0);

		HarvestResult result = service.harvest(new HarvestJob(FetchTarget.contributors("acme/widgets")));

		assertThat(result.status()).isEqualTo(HarvestStatus.COMPLETED);
		assertThat(result.recordCount()).isEqualTo(10);
		assertThat(result.pagesFetched()).isEqualTo(6);
		assertThat(result.exportPath()).isEqualTo(tempDir.resolve("github_repo_contributions_acme_widgets.csv.gz"));

		List<List<String>> rows = GitHubFixtures.readExport(result.exportPath());
		assertThat(rows.get(0)).containsExactlyElementsOf(ContributorRecord.COLUMNS);
		assertThat(rows.get(1)).containsExactly("dev-10", "90", "https://github.com/dev-10", "acme/widgets",
				"Widgets for everyone", "42", "7", "3", "10/03/2019");
		assertThat(rows).hasSize(11);
	}

	@Test
	@DisplayName("Should fetch the repository before the contributor listing")
	void shouldFetchRepositoryFirst() {
		stubPages(0);

		service.harvest(new HarvestJob(FetchTarget.contributors("acme", "widgets")));

		var order = inOrder(mockClient);
		order.verify(mockClient).get(REPOSITORY_PATH);
		order.verify(mockClient).get(FIRST_PAGE);
	}

	@Test
	@DisplayName("Should fail without export when a listing page is not found")
	void shouldFailOnMissingPage() throws Exception {
		stubPages(3);

		HarvestResult result = service.harvest(new HarvestJob(FetchTarget.contributors("acme/widgets")));

		assertThat(result.status()).isEqualTo(HarvestStatus.FAILED);
		assertThat(result.exportPath()).isNull();
		assertThat(result.failureReason()).contains("Not found");
		verify(mockClient, never()).get(pageLink(4));
		try (var files = Files.list(tempDir)) {
			assertThat(files).isEmpty();
		}
	}

	@Test
	@DisplayName("Should not list contributors of a repository that does not exist")
	void shouldFailOnMissingRepository() {
		when(mockClient.get(REPOSITORY_PATH)).thenThrow(GitHubFixtures.notFound(REPOSITORY_PATH));

		HarvestResult result = service.harvest(new HarvestJob(FetchTarget.contributors("acme/widgets")));

		assertThat(result.isSuccessful()).isFalse();
		verify(mockClient, never()).get(FIRST_PAGE);
	}

	@Test
	@DisplayName("Should keep the partial file when the export cannot be written")
	void shouldKeepPartialFileOnExportFailure() throws Exception {
		stubPages(0);
		ObjectMapper objectMapper = ObjectMapperFactory.create();
		HarvestProperties properties = new HarvestProperties();
		properties.setOutputDirectory(tempDir.toString());
		ContributorsHarvestService failingService = new ContributorsHarvestService(crawler, failingOnRow(3),
				new JsonNodeUtils(), objectMapper, properties);

		HarvestResult result = failingService.harvest(new HarvestJob(FetchTarget.contributors("acme/widgets")));

		assertThat(result.status()).isEqualTo(HarvestStatus.FAILED);
		assertThat(result.exportPath()).isNull();
		assertThat(result.recordCount()).isEqualTo(2);
		assertThat(result.failureReason()).startsWith("Export write failed: disk full");

		Path partFile = tempDir.resolve("github_repo_contributions_acme_widgets.csv.gz.part");
		List<List<String>> rows = GitHubFixtures.readExport(partFile);
		assertThat(rows).hasSize(3);
		assertThat(rows.get(0)).containsExactlyElementsOf(ContributorRecord.COLUMNS);
		assertThat(rows.subList(1, 3)).extracting(row -> row.get(0)).containsExactly("dev-10", "dev-11");
		assertThat(tempDir.resolve("github_repo_contributions_acme_widgets.csv.gz")).doesNotExist();
		assertThat(tempDir.resolve("github_repo_contributions_acme_widgets.metadata.json")).doesNotExist();
	}

	/**
	 * A gzip CSV sink flushing every row whose writer fails on the given row.
	 */
	private static ExportSink failingOnRow(int failingRow) {
		GzipCsvExportSink delegate = new GzipCsvExportSink(1);
		return (path, header) -> {
			ExportWriter writer = delegate.open(path, header);
			return new ExportWriter() {

				@Override
				public void writeRow(NormalizedRecord row) {
					if (writer.rowCount() + 1 == failingRow) {
						throw new ExportWriteException(path, "disk full", new IOException("No space left on device"));
					}
					writer.writeRow(row);
				}

				@Override
				public int rowCount() {
					return writer.rowCount();
				}

				@Override
				public Path path() {
					return writer.path();
				}

				@Override
				public void close() {
					writer.close();
				}

			};
		};
	}

	@Test
	@DisplayName("Should drop anonymous contributors")
	void shouldDropAnonymousContributors() throws Exception {
		when(mockClient.get(REPOSITORY_PATH))
			.thenReturn(GitHubFixtures.response(GitHubFixtures.repository("acme/widgets")));
		when(mockClient.get(FIRST_PAGE)).thenReturn(GitHubFixtures.response(
				"[{\"login\":\"dev-1\",\"contributions\":5},{\"type\":\"Anonymous\",\"name\":\"someone\",\"contributions\":2}]"));

		HarvestResult result = service.harvest(new HarvestJob(FetchTarget.contributors("acme/widgets")));

		assertThat(result.isSuccessful()).isTrue();
		assertThat(result.recordCount()).isEqualTo(1);
		assertThat(result.droppedRecords()).isEqualTo(1);
	}

}
