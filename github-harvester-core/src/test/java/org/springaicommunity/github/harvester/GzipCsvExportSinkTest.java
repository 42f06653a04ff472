package org.springaicommunity.github.harvester;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPInputStream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GzipCsvExportSink Tests")
class GzipCsvExportSinkTest {

	@TempDir
	Path tempDir;

	private static ForkRecord fork(String name, String description) {
		return new ForkRecord("octocat/" + name, name, description, "https://github.com/octocat/" + name,
				"github/" + name, "02/08/2016", "");
	}

	/**
	 * Decompress a gzip file whose trailer has not been written yet.
	 */
	private static String readFlushedText(Path path) throws IOException {
		ByteArrayOutputStream text = new ByteArrayOutputStream();
		try (GZIPInputStream in = new GZIPInputStream(Files.newInputStream(path))) {
			byte[] buffer = new byte[1024];
			int read;
			while ((read = in.read(buffer)) != -1) {
				text.write(buffer, 0, read);
			}
		}
		catch (EOFException e) {
			// expected: the stream ends at the last sync flush
		}
		return text.toString(StandardCharsets.UTF_8);
	}

	@Test
	@DisplayName("Should write header and rows as gzip CSV")
	void shouldWriteHeaderAndRows() throws IOException {
		Path file = tempDir.resolve("forks.csv.gz");

		try (ExportWriter writer = new GzipCsvExportSink().open(file, HarvestKind.FORKS.columns())) {
			writer.writeRow(fork("linguist", "Language Savant"));
			writer.writeRow(fork("hub", "Wraps git, \"with\" quotes"));
			assertThat(writer.rowCount()).isEqualTo(2);
			assertThat(writer.path()).isEqualTo(file);
		}

		List<List<String>> rows = GitHubFixtures.readExport(file);
		assertThat(rows).hasSize(3);
		assertThat(rows.get(0)).containsExactlyElementsOf(HarvestKind.FORKS.columns());
		assertThat(rows.get(2)).containsExactly("octocat/hub", "hub", "Wraps git, \"with\" quotes",
				"https://github.com/octocat/hub", "github/hub", "02/08/2016", "");
	}

	@Test
	@DisplayName("Should write a header-only file when there are no rows")
	void shouldWriteHeaderOnly() throws IOException {
		Path file = tempDir.resolve("empty.csv.gz");

		new GzipCsvExportSink().open(file, HarvestKind.FOLLOWERS.columns()).close();

		assertThat(GitHubFixtures.readExport(file)).containsExactly(HarvestKind.FOLLOWERS.columns());
	}

	@Test
	@DisplayName("Should leave flushed rows readable before the writer is closed")
	void shouldFlushPeriodically() throws IOException {
		Path file = tempDir.resolve("partial.csv.gz");
		ExportWriter writer = new GzipCsvExportSink(2).open(file, HarvestKind.FORKS.columns());
		writer.writeRow(fork("one", ""));
		writer.writeRow(fork("two", ""));

		byte[] flushed = Files.readAllBytes(file);
		Path copy = tempDir.resolve("copy.csv.gz");
		Files.write(copy, flushed);

		assertThat(readFlushedText(copy)).startsWith("full_name,name,")
			.contains("octocat/one")
			.contains("octocat/two");
		writer.close();
		assertThat(GitHubFixtures.readExport(file)).hasSize(3);
	}

	@Test
	@DisplayName("Should reject rows that do not match the header")
	void shouldRejectMismatchedRow() {
		try (ExportWriter writer = new GzipCsvExportSink().open(tempDir.resolve("x.csv.gz"),
				HarvestKind.FOLLOWERS.columns())) {
			assertThatThrownBy(() -> writer.writeRow(fork("linguist", ""))).isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Test
	@DisplayName("Should raise an export error when the file cannot be created")
	void shouldFailOnUnwritablePath() {
		Path file = tempDir.resolve("missing-dir").resolve("x.csv.gz");

		assertThatThrownBy(() -> new GzipCsvExportSink().open(file, HarvestKind.FORKS.columns()))
			.isInstanceOfSatisfying(ExportWriteException.class, e -> assertThat(e.getPath()).isEqualTo(file));
	}

}
