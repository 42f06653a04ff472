package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the follower, contributor and fork normalizers.
 */
@DisplayName("Record Normalizer Tests")
class RecordNormalizerTest {

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private final JsonNodeUtils jsonUtils = new JsonNodeUtils();

	private JsonNode json(String text) throws Exception {
		return objectMapper.readTree(text);
	}

	@Nested
	@DisplayName("Follower Tests")
	class FollowerTest {

		private final FollowerNormalizer normalizer = new FollowerNormalizer(jsonUtils);

		@Test
		@DisplayName("Should normalize a full profile")
		void shouldNormalizeProfile() throws Exception {
			FollowerRecord record = normalizer.normalize(json("""
					{"login":"octocat","name":"The Octocat 🐙","company":"@github","blog":"https://github.blog",
					 "email":null,"bio":"Line one\\nLine two","public_repos":8,"followers":9000,"following":9,
					 "created_at":"2011-01-25T18:44:36Z","site_admin":false}
					"""));

			assertThat(record.values()).containsExactly("octocat", "The Octocat", "github", "https://github.blog", "",
					"Line one Line two", "8", "9000", "9", "25/01/2011");
			assertThat(record.values()).hasSameSizeAs(HarvestKind.FOLLOWERS.columns());
		}

		@Test
		@DisplayName("Should fill absent fields with empty strings")
		void shouldFillAbsentFields() throws Exception {
			FollowerRecord record = normalizer.normalize(json("{\"login\":\"minimal\"}"));

			assertThat(record.login()).isEqualTo("minimal");
			assertThat(record.values()).hasSize(10).allSatisfy(value -> assertThat(value).isNotNull());
			assertThat(record.createdAt()).isEmpty();
			assertThat(record.publicRepos()).isEmpty();
		}

		@Test
		@DisplayName("Should reject a profile without login")
		void shouldRejectMissingLogin() {
			assertThatThrownBy(() -> normalizer.normalize(json("{\"name\":\"nobody\"}")))
				.isInstanceOfSatisfying(MalformedRecordException.class,
						e -> assertThat(e.getMissingField()).isEqualTo("login"));
		}

		@Test
		@DisplayName("Should produce identical rows for identical input")
		void shouldBeDeterministic() throws Exception {
			JsonNode raw = json(GitHubFixtures.userProfile("hubot"));

			assertThat(normalizer.normalize(raw)).isEqualTo(normalizer.normalize(raw.deepCopy()));
		}

	}

	@Nested
	@DisplayName("Contributor Tests")
	class ContributorTest {

		@Test
		@DisplayName("Should repeat repository details on every contributor")
		void shouldAddRepositoryColumns() throws Exception {
			ContributorNormalizer normalizer = new ContributorNormalizer(jsonUtils,
					json(GitHubFixtures.repository("acme/widgets")));

			ContributorRecord record = normalizer.normalize(
					json("{\"login\":\"dev-1\",\"contributions\":321,\"html_url\":\"https://github.com/dev-1\"}"));

			assertThat(record.values()).containsExactly("dev-1", "321", "https://github.com/dev-1", "acme/widgets",
					"Widgets for everyone", "42", "7", "3", "10/03/2019");
		}

		@Test
		@DisplayName("Should reject anonymous contributors")
		void shouldRejectAnonymousContributor() throws Exception {
			ContributorNormalizer normalizer = new ContributorNormalizer(jsonUtils,
					json(GitHubFixtures.repository("acme/widgets")));

			assertThatThrownBy(
					() -> normalizer.normalize(json("{\"type\":\"Anonymous\",\"email\":\"a@b.c\",\"contributions\":3}")))
				.isInstanceOf(MalformedRecordException.class);
		}

	}

	@Nested
	@DisplayName("Fork Tests")
	class ForkTest {

		private final ForkNormalizer normalizer = new ForkNormalizer(jsonUtils);

		@Test
		@DisplayName("Should normalize a fork with its parent")
		void shouldNormalizeFork() throws Exception {
			JsonNode raw = json("""
					{"full_name":"octocat/linguist","name":"linguist","description":"Language Savant ✨",
					 "html_url":"https://github.com/octocat/linguist","fork":true,
					 "parent":{"full_name":"github/linguist"},
					 "created_at":"2016-08-02T17:35:14Z","updated_at":"2024-02-29T23:59:59Z"}
					""");

			assertThat(normalizer.isFork(raw)).isTrue();
			assertThat(normalizer.normalize(raw).values()).containsExactly("octocat/linguist", "linguist",
					"Language Savant", "https://github.com/octocat/linguist", "github/linguist", "02/08/2016",
					"29/02/2024");
		}

		@Test
		@DisplayName("Should recognize repositories that are not forks")
		void shouldRecognizeNonFork() throws Exception {
			assertThat(normalizer.isFork(json("{\"full_name\":\"octocat/Hello-World\",\"fork\":false}"))).isFalse();
			assertThat(normalizer.isFork(json("{\"full_name\":\"octocat/Spoon-Knife\"}"))).isFalse();
		}

	}

}
