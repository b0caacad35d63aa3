package com.aycom.explore.normalize;

import static com.aycom.explore.normalize.FieldResolver.at;
import static com.aycom.explore.normalize.FieldResolver.count;
import static com.aycom.explore.normalize.FieldResolver.flag;
import static com.aycom.explore.normalize.FieldResolver.optionalCount;
import static com.aycom.explore.normalize.FieldResolver.text;
import static com.aycom.explore.normalize.FieldResolver.textOrDefault;
import static com.aycom.explore.normalize.FieldResolver.timestamp;

import com.aycom.explore.model.CategoryFacet;
import com.aycom.explore.model.CommunityResult;
import com.aycom.explore.model.MediaRef;
import com.aycom.explore.model.MediaType;
import com.aycom.explore.model.PageState;
import com.aycom.explore.model.ProfileResult;
import com.aycom.explore.model.ThreadResult;
import com.aycom.explore.model.TrendingTag;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Adapters from upstream payloads to the canonical result types. Every provider gets its own
 * entry point; field-level fallbacks live in {@link FieldResolver}.
 */
@Component
public class ResultNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ResultNormalizer.class);
    private static final String DEFAULT_DISPLAY_NAME = "User";

    private static final String[] TOTAL_COUNT_PATHS = {
        "total_count",
        "totalCount",
        "total",
        "pagination.total_count",
        "pagination.totalCount",
        "pagination.total",
        "data.total_count",
        "data.totalCount",
        "data.total",
        "data.pagination.total_count",
        "data.pagination.totalCount",
        "data.pagination.total"
    };

    private final Clock clock;

    public ResultNormalizer(Clock clock) {
        this.clock = clock;
    }

    public ResultPage<ProfileResult> profiles(JsonNode payload, PageState requested) {
        List<ProfileResult> items = normalizeList(payload, "users", "profile", false, this::profile);
        return new ResultPage<>(items, resolveTotal(payload, requested, items.size()));
    }

    public ResultPage<ThreadResult> threads(JsonNode payload, PageState requested) {
        List<ThreadResult> items = normalizeList(payload, "threads", "thread", false, this::thread);
        return new ResultPage<>(items, resolveTotal(payload, requested, items.size()));
    }

    public ResultPage<CommunityResult> communities(JsonNode payload, PageState requested) {
        List<CommunityResult> items = normalizeList(payload, "communities", "community", false, this::community);
        return new ResultPage<>(items, resolveTotal(payload, requested, items.size()));
    }

    public List<TrendingTag> trendingTags(JsonNode payload) {
        return normalizeList(payload, "trends", "trend", true, this::trendingTag);
    }

    public List<CategoryFacet> categories(JsonNode payload) {
        return normalizeList(payload, "categories", "category", false, this::category);
    }

    ProfileResult profile(JsonNode node) {
        String id = text(node, "id", "user_id", "userId");
        if (id == null) {
            return null;
        }
        String username = textOrDefault(node, "", "username", "user_name", "handle");
        String displayName = text(node, "display_name", "displayName", "name");
        if (displayName == null) {
            displayName = username.isEmpty() ? DEFAULT_DISPLAY_NAME : username;
        }
        return new ProfileResult(
            id,
            username,
            displayName,
            text(node, "profile_picture_url", "profilePictureUrl", "profile_picture", "profilePicture",
                "avatar_url", "avatarUrl", "avatar"),
            text(node, "bio", "description"),
            flag(node, "is_verified", "isVerified", "verified"),
            count(node, "follower_count", "followerCount", "followers_count", "followersCount",
                "metrics.followers", "metrics.follower_count"),
            flag(node, "is_following", "isFollowing", "following"),
            null
        );
    }

    ThreadResult thread(JsonNode node) {
        String id = text(node, "id", "thread_id", "threadId");
        if (id == null) {
            return null;
        }
        String username = textOrDefault(node, "",
            "author.username", "user.username", "username", "author_username", "authorUsername");
        String displayName = text(node,
            "author.display_name", "author.displayName", "author.name",
            "user.display_name", "user.displayName", "user.name",
            "display_name", "displayName", "author_name", "authorName", "name");
        if (displayName == null) {
            displayName = username.isEmpty() ? DEFAULT_DISPLAY_NAME : username;
        }
        return new ThreadResult(
            id,
            textOrDefault(node, "", "content", "text", "body"),
            username,
            displayName,
            text(node,
                "author.profile_picture_url", "author.profilePictureUrl", "author.avatar",
                "user.profile_picture_url", "user.profilePictureUrl", "user.avatar",
                "profile_picture_url", "profilePictureUrl", "author_avatar", "authorAvatar", "avatar"),
            timestamp(node, Instant.now(clock), "created_at", "createdAt", "timestamp", "posted_at"),
            count(node, "like_count", "likes_count", "likeCount", "likesCount", "metrics.likes", "metrics.like_count"),
            count(node, "reply_count", "replies_count", "replyCount", "repliesCount",
                "metrics.replies", "metrics.reply_count"),
            count(node, "repost_count", "reposts_count", "repostCount", "repostsCount",
                "metrics.reposts", "metrics.repost_count"),
            media(node)
        );
    }

    CommunityResult community(JsonNode node) {
        String id = text(node, "id", "community_id", "communityId");
        if (id == null) {
            return null;
        }
        return new CommunityResult(
            id,
            textOrDefault(node, "", "name", "title"),
            text(node, "description"),
            text(node, "logo_url", "logoUrl", "logo", "avatar"),
            count(node, "member_count", "memberCount", "members_count", "membersCount", "metrics.members"),
            flag(node, "is_joined", "isJoined", "is_member", "isMember"),
            flag(node, "is_pending", "isPending", "has_pending_request", "hasPendingRequest")
        );
    }

    TrendingTag trendingTag(JsonNode node) {
        if (node.isTextual()) {
            String title = node.asText().trim();
            return title.isEmpty() ? null : new TrendingTag(title, title, null, 0L, title);
        }
        String title = text(node, "title", "name", "tag", "hashtag");
        String id = text(node, "id", "trend_id", "trendId");
        if (id == null) {
            id = title;
        }
        if (id == null) {
            return null;
        }
        return new TrendingTag(
            id,
            title,
            text(node, "category"),
            count(node, "post_count", "postCount", "tweet_count", "tweetCount", "count"),
            text(node, "query")
        );
    }

    CategoryFacet category(JsonNode node) {
        String id = text(node, "id", "category_id", "categoryId");
        String name = text(node, "name", "title");
        if (id == null) {
            id = name;
        }
        if (id == null) {
            return null;
        }
        return new CategoryFacet(
            id,
            name,
            text(node, "description"),
            text(node, "slug"),
            count(node, "thread_count", "threadCount", "post_count")
        );
    }

    private List<MediaRef> media(JsonNode node) {
        JsonNode media = at(node, "media");
        if (!media.isArray()) {
            media = at(node, "attachments");
        }
        if (!media.isArray()) {
            media = at(node, "media_urls");
        }
        if (!media.isArray()) {
            return List.of();
        }
        List<MediaRef> refs = new ArrayList<>();
        for (JsonNode item : media) {
            if (item.isTextual()) {
                String url = item.asText().trim();
                if (!url.isEmpty()) {
                    refs.add(new MediaRef(url, MediaType.fromString(null, url)));
                }
                continue;
            }
            String url = text(item, "url", "media_url", "mediaUrl", "src");
            if (url == null) {
                continue;
            }
            refs.add(new MediaRef(url, MediaType.fromString(text(item, "type", "media_type", "mediaType"), url)));
        }
        return refs;
    }

    private <T> List<T> normalizeList(
        JsonNode payload,
        String field,
        String kind,
        boolean acceptText,
        Function<JsonNode, T> adapter
    ) {
        JsonNode list = resolveList(payload, field);
        List<T> items = new ArrayList<>(list.size());
        int index = 0;
        for (JsonNode node : list) {
            T item = null;
            if (node != null && (node.isObject() || (acceptText && node.isTextual()))) {
                item = adapter.apply(node);
            }
            if (item == null) {
                log.debug("dropped malformed {} at index={}", kind, index);
            } else {
                items.add(item);
            }
            index++;
        }
        return items;
    }

    private JsonNode resolveList(JsonNode payload, String field) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            throw new EmptyResponseException("empty " + field + " payload");
        }
        if (payload.isArray()) {
            return payload;
        }
        if (!payload.isObject()) {
            throw new MalformedResponseException("unexpected " + field + " payload type " + payload.getNodeType());
        }
        JsonNode data = payload.path("data");
        for (JsonNode candidate : new JsonNode[] {payload.path(field), data.path(field), data}) {
            if (candidate.isArray()) {
                return candidate;
            }
            if (candidate != data && !candidate.isMissingNode() && !candidate.isNull()) {
                throw new MalformedResponseException("field '" + field + "' is not a list");
            }
        }
        return JsonNodeFactory.instance.arrayNode();
    }

    private long resolveTotal(JsonNode payload, PageState requested, int itemCount) {
        Long total = optionalCount(payload, TOTAL_COUNT_PATHS);
        if (total != null) {
            return total;
        }
        int page = requested == null ? 1 : requested.getPage();
        int perPage = requested == null ? itemCount : requested.getPerPage();
        return (long) (page - 1) * perPage + itemCount;
    }
}
