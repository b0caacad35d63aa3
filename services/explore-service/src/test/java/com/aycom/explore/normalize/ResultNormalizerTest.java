package com.aycom.explore.normalize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aycom.explore.model.CategoryFacet;
import com.aycom.explore.model.CommunityResult;
import com.aycom.explore.model.MediaRef;
import com.aycom.explore.model.MediaType;
import com.aycom.explore.model.PageState;
import com.aycom.explore.model.ProfileResult;
import com.aycom.explore.model.ThreadResult;
import com.aycom.explore.model.TrendingTag;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResultNormalizerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final ObjectMapper mapper = JsonMapper.builder().enable(JsonReadFeature.ALLOW_SINGLE_QUOTES).build();
    private ResultNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new ResultNormalizer(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void profilesResolveFallbackChainsAndDropMalformedItems() throws Exception {
        JsonNode payload = mapper.readTree("{'users': [ "
                + "{'id': 'u1', 'username': 'alice', 'display_name': 'Alice A', 'follower_count': '12', "
                + "'is_verified': true, 'profile_picture_url': 'https://cdn/a.png'}, "
                + "{'user_id': 2, 'username': 'bob', 'followersCount': -4}, "
                + "'not-an-object', "
                + "{'username': 'ghost'}, "
                + "{'id': 'u3'} "
                + "], 'total_count': 7}");

        ResultPage<ProfileResult> page = normalizer.profiles(payload, PageState.first(25));

        assertThat(page.getTotalCount()).isEqualTo(7);
        assertThat(page.getItems()).extracting(ProfileResult::getId).containsExactly("u1", "2", "u3");
        ProfileResult alice = page.getItems().get(0);
        assertThat(alice.getDisplayName()).isEqualTo("Alice A");
        assertThat(alice.getFollowerCount()).isEqualTo(12);
        assertThat(alice.isVerified()).isTrue();
        assertThat(alice.getAvatarUrl()).isEqualTo("https://cdn/a.png");
        ProfileResult bob = page.getItems().get(1);
        assertThat(bob.getDisplayName()).isEqualTo("bob");
        assertThat(bob.getFollowerCount()).isZero();
        assertThat(page.getItems().get(2).getDisplayName()).isEqualTo("User");
    }

    @Test
    void threadsReadNestedAuthorMetricsAndMedia() throws Exception {
        JsonNode payload = mapper.readTree("{'data': {'threads': [ "
                + "{'thread_id': 't1', 'content': 'hello rust', "
                + "'author': {'username': 'ferris', 'name': 'Ferris'}, "
                + "'metrics': {'likes': 3.9, 'replies': '2'}, "
                + "'repostCount': 1, "
                + "'created_at': 1714564800, "
                + "'media': [{'url': 'https://cdn/v.mp4'}, {'url': 'https://cdn/p', 'type': 'photo'}, 'https://cdn/x.gif']}, "
                + "{'id': 't2', 'text': 'camel', 'user': {'username': 'crab'}, 'createdAt': '2024-04-30T10:00:00+02:00'} "
                + "], 'pagination': {'total_count': 30}}}");

        ResultPage<ThreadResult> page = normalizer.threads(payload, PageState.first(10));

        assertThat(page.getTotalCount()).isEqualTo(30);
        ThreadResult first = page.getItems().get(0);
        assertThat(first.getAuthorUsername()).isEqualTo("ferris");
        assertThat(first.getAuthorDisplayName()).isEqualTo("Ferris");
        assertThat(first.getLikeCount()).isEqualTo(3);
        assertThat(first.getReplyCount()).isEqualTo(2);
        assertThat(first.getRepostCount()).isEqualTo(1);
        assertThat(first.getCreatedAt()).isEqualTo(Instant.ofEpochSecond(1714564800L));
        assertThat(first.getMedia()).extracting(MediaRef::getType)
            .containsExactly(MediaType.VIDEO, MediaType.IMAGE, MediaType.GIF);
        assertThat(first.hasMedia()).isTrue();

        ThreadResult second = page.getItems().get(1);
        assertThat(second.getContent()).isEqualTo("camel");
        assertThat(second.getAuthorDisplayName()).isEqualTo("crab");
        assertThat(second.getCreatedAt()).isEqualTo(Instant.parse("2024-04-30T08:00:00Z"));
        assertThat(second.hasMedia()).isFalse();
    }

    @Test
    void unparsableTimestampFallsBackToNow() throws Exception {
        JsonNode payload = mapper.readTree("[{\"id\": \"t1\", \"created_at\": \"yesterday\"}]");

        ResultPage<ThreadResult> page = normalizer.threads(payload, PageState.first(10));

        assertThat(page.getItems().get(0).getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void missingTotalCountIsDerivedFromPageAndItems() throws Exception {
        JsonNode payload = mapper.readTree("{\"communities\": [{\"id\": \"c1\"}, {\"id\": \"c2\"}, {\"id\": \"c3\"}]}");

        ResultPage<CommunityResult> page = normalizer.communities(payload, PageState.of(2, 10, 40));

        assertThat(page.getTotalCount()).isEqualTo(13);
    }

    @Test
    void communitiesResolveMembershipFlags() throws Exception {
        JsonNode payload = mapper.readTree("{'communities': [ "
                + "{'id': 'c1', 'name': 'Rustaceans', 'member_count': '120', 'is_joined': 'true'}, "
                + "{'community_id': 'c2', 'title': 'Crabs', 'hasPendingRequest': 1} "
                + "]}");

        List<CommunityResult> items = normalizer.communities(payload, PageState.first(10)).getItems();

        assertThat(items.get(0).getMemberCount()).isEqualTo(120);
        assertThat(items.get(0).isJoined()).isTrue();
        assertThat(items.get(1).getName()).isEqualTo("Crabs");
        assertThat(items.get(1).isPending()).isTrue();
        assertThat(items.get(1).isJoined()).isFalse();
    }

    @Test
    void missingListFieldYieldsEmptyPage() throws Exception {
        ResultPage<ThreadResult> page = normalizer.threads(mapper.readTree("{\"message\": \"ok\"}"), PageState.first(10));

        assertThat(page.getItems()).isEmpty();
        assertThat(page.getTotalCount()).isZero();
    }

    @Test
    void nullPayloadIsEmptyResponse() {
        assertThatThrownBy(() -> normalizer.profiles(null, PageState.first(25)))
            .isInstanceOf(EmptyResponseException.class);
        assertThatThrownBy(() -> normalizer.profiles(NullNode.getInstance(), PageState.first(25)))
            .isInstanceOf(EmptyResponseException.class);
    }

    @Test
    void wrongPayloadShapeIsMalformed() throws Exception {
        assertThatThrownBy(() -> normalizer.profiles(mapper.readTree("\"boom\""), PageState.first(25)))
            .isInstanceOf(MalformedResponseException.class);
        assertThatThrownBy(() -> normalizer.profiles(mapper.readTree("{\"users\": {\"id\": 1}}"), PageState.first(25)))
            .isInstanceOf(MalformedResponseException.class);
    }

    @Test
    void trendingTagsAcceptPlainStringsAndObjects() throws Exception {
        JsonNode payload = mapper.readTree("{'trends': ['#rust', {'name': '#java', 'tweet_count': 40, 'category': 'tech'}, {'count': 3}, '  ']}");

        List<TrendingTag> tags = normalizer.trendingTags(payload);

        assertThat(tags).extracting(TrendingTag::getTitle).containsExactly("#rust", "#java");
        assertThat(tags.get(1).getPostCount()).isEqualTo(40);
        assertThat(tags.get(1).getCategory()).isEqualTo("tech");
    }

    @Test
    void categoriesUseNameWhenIdIsMissing() throws Exception {
        List<CategoryFacet> facets = normalizer.categories(mapper.readTree("[{'id': '7', 'name': 'Tech', 'slug': 'tech'}, {'name': 'Gaming'}, {'description': 'nameless'}]"));

        assertThat(facets).extracting(CategoryFacet::getId).containsExactly("7", "Gaming");
        assertThat(facets.get(0).getSlug()).isEqualTo("tech");
    }
}
