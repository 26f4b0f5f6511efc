package com.discussboard.backend.modules.post.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.audit.application.AuditLogService;
import com.discussboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.platform.application.ForbiddenWordService;
import com.discussboard.backend.modules.post.domain.Post;
import com.discussboard.backend.modules.post.domain.PostEditHistory;
import com.discussboard.backend.modules.post.domain.PostStatus;
import com.discussboard.backend.modules.post.domain.PostTag;
import com.discussboard.backend.modules.post.infrastructure.persistence.PostEditHistoryRepository;
import com.discussboard.backend.modules.post.infrastructure.persistence.PostRepository;
import com.discussboard.backend.modules.post.infrastructure.persistence.PostTagRepository;
import com.discussboard.backend.modules.post.presentation.dto.PostCreateRequest;
import com.discussboard.backend.modules.post.presentation.dto.PostResponse;
import com.discussboard.backend.modules.post.presentation.dto.PostSearchRequest;
import com.discussboard.backend.modules.post.presentation.dto.PostSummaryResponse;
import com.discussboard.backend.modules.post.presentation.dto.PostUpdateRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class PostService {

    private static final Logger log = LoggerFactory.getLogger(PostService.class);
    static final Set<String> SORT_FIELDS = Set.of("createdAt", "updatedAt", "title");
    private static final String TABLE = "discuss_board_posts";

    private final PostRepository postRepository;
    private final PostTagRepository postTagRepository;
    private final PostEditHistoryRepository editHistoryRepository;
    private final ActorLookupService actorLookupService;
    private final ForbiddenWordService forbiddenWordService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public PostService(
            PostRepository postRepository,
            PostTagRepository postTagRepository,
            PostEditHistoryRepository editHistoryRepository,
            ActorLookupService actorLookupService,
            ForbiddenWordService forbiddenWordService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.postRepository = postRepository;
        this.postTagRepository = postTagRepository;
        this.editHistoryRepository = editHistoryRepository;
        this.actorLookupService = actorLookupService;
        this.forbiddenWordService = forbiddenWordService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Creates the post and its distinct tag links together; a failing link rolls back the post.
     */
    public PostResponse create(UUID authorMemberId, PostCreateRequest request) {
        Member author = actorLookupService.requireMember(authorMemberId);
        forbiddenWordService.assertClean(request.title(), request.body());

        Post post = new Post();
        post.setAuthor(author);
        post.setTitle(request.title().trim());
        post.setBody(request.body());
        PostStatus status = parseStatus(request.businessStatus());
        post.setBusinessStatus(status != null ? status : PostStatus.PUBLIC);
        post = postRepository.save(post);

        List<UUID> tagIds = new ArrayList<>();
        if (request.tagIds() != null) {
            Set<UUID> distinct = new LinkedHashSet<>(request.tagIds());
            distinct.remove(null);
            for (UUID tagId : distinct) {
                postTagRepository.save(new PostTag(post, tagId));
                tagIds.add(tagId);
            }
        }
        log.debug("Post {} created by member {} with {} tags", post.getId(), authorMemberId, tagIds.size());
        return PostResponse.from(post, tagIds);
    }

    @Transactional(readOnly = true)
    public PageResponse<PostSummaryResponse> search(PostSearchRequest request) {
        return PageResponse.from(postRepository.search(
                PageQuery.likePattern(request.keyword()),
                request.authorId(),
                parseStatus(request.status()),
                request.tagId(),
                request.createdFrom(),
                request.createdTo(),
                PageQuery.of(request.page(), request.limit(), request.sortBy(), request.sortDirection(), SORT_FIELDS)
        ), PostSummaryResponse::from);
    }

    @Transactional(readOnly = true)
    public PostResponse get(UUID postId) {
        Post post = loadActive(postId);
        return PostResponse.from(post, postTagRepository.findTagIdsByPostId(post.getId()));
    }

    public PostResponse updateAsAuthor(UUID memberId, UUID postId, PostUpdateRequest request) {
        Post post = loadActive(postId);
        requireAuthor(post, memberId);
        applyUpdate(post, actorLookupService.requireMember(memberId), request);
        return PostResponse.from(post, postTagRepository.findTagIdsByPostId(post.getId()));
    }

    public void eraseAsAuthor(UUID memberId, UUID postId) {
        Post post = loadActive(postId);
        requireAuthor(post, memberId);
        post.markDeleted(OffsetDateTime.now(clock));
        postRepository.save(post);
    }

    public PostResponse updateAsStaff(ActorType actorType, UUID actorMemberId, UUID postId,
                                      PostUpdateRequest request) {
        Member editor = requireStaff(actorType, actorMemberId);
        Post post = loadActive(postId);
        applyUpdate(post, editor, request);
        audit(actorType, actorMemberId, "post_update", post);
        return PostResponse.from(post, postTagRepository.findTagIdsByPostId(post.getId()));
    }

    public void eraseAsModerator(UUID actorMemberId, UUID postId) {
        requireStaff(ActorType.MODERATOR, actorMemberId);
        Post post = loadActive(postId);
        post.markDeleted(OffsetDateTime.now(clock));
        postRepository.save(post);
        audit(ActorType.MODERATOR, actorMemberId, "post_delete", post);
        log.info("Post {} removed by moderator member {}", postId, actorMemberId);
    }

    public Post loadActive(UUID postId) {
        return postRepository.findActiveById(postId)
                .orElseThrow(() -> ProblemException.notFound("POST_NOT_FOUND", "Post not found"));
    }

    public static void requireAuthor(Post post, UUID memberId) {
        if (!post.isAuthoredBy(memberId)) {
            throw ProblemException.forbidden("NOT_POST_AUTHOR", "Only the author may change this post");
        }
    }

    public Member requireStaff(ActorType actorType, UUID actorMemberId) {
        return actorLookupService.requireStaff(actorType, actorMemberId);
    }

    private void applyUpdate(Post post, Member editor, PostUpdateRequest request) {
        String title = request.title() != null && !request.title().isBlank() ? request.title().trim() : post.getTitle();
        String body = request.body() != null && !request.body().isBlank() ? request.body() : post.getBody();
        PostStatus status = parseStatus(request.businessStatus());
        forbiddenWordService.assertClean(title, body);

        boolean contentChanged = !Objects.equals(title, post.getTitle()) || !Objects.equals(body, post.getBody());
        if (contentChanged) {
            PostEditHistory history = new PostEditHistory();
            history.setPost(post);
            history.setEditor(editor);
            history.setEditedTitle(post.getTitle());
            history.setEditedBody(post.getBody());
            history.setEditReason(request.editReason());
            editHistoryRepository.save(history);
        }
        post.setTitle(title);
        post.setBody(body);
        if (status != null) {
            post.setBusinessStatus(status);
        }
        postRepository.saveAndFlush(post);
    }

    private void audit(ActorType actorType, UUID actorMemberId, String category, Post post) {
        auditLogService.record(new AuditLogCommand(
                actorMemberId,
                actorType.name().toLowerCase(Locale.ROOT),
                category,
                TABLE,
                post.getId(),
                "Post " + post.getTitle(),
                Map.of("authorId", post.getAuthor().getId().toString())
        ));
    }

    private static PostStatus parseStatus(String raw) {
        return EnumValues.parseOptional(PostStatus.class, raw, "INVALID_POST_STATUS");
    }
}
