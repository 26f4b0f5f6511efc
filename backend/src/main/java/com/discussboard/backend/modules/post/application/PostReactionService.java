package com.discussboard.backend.modules.post.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.post.domain.Post;
import com.discussboard.backend.modules.post.domain.PostReaction;
import com.discussboard.backend.modules.post.domain.ReactionType;
import com.discussboard.backend.modules.post.infrastructure.persistence.PostReactionRepository;
import com.discussboard.backend.modules.post.presentation.dto.PostReactionRequest;
import com.discussboard.backend.modules.post.presentation.dto.PostReactionResponse;
import com.discussboard.backend.modules.post.presentation.dto.PostReactionSearchRequest;
import com.discussboard.backend.modules.post.presentation.dto.ReactionUpdateRequest;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class PostReactionService {

    static final Set<String> SORT_FIELDS = Set.of("createdAt", "updatedAt");

    private final PostReactionRepository reactionRepository;
    private final PostService postService;
    private final ActorLookupService actorLookupService;
    private final Clock clock;

    public PostReactionService(
            PostReactionRepository reactionRepository,
            PostService postService,
            ActorLookupService actorLookupService,
            Clock clock
    ) {
        this.reactionRepository = reactionRepository;
        this.postService = postService;
        this.actorLookupService = actorLookupService;
        this.clock = clock;
    }

    public PostReactionResponse create(UUID memberId, PostReactionRequest request) {
        ReactionType type = parseType(request.reactionType());
        Post post = postService.loadActive(request.postId());
        if (post.isAuthoredBy(memberId)) {
            throw ProblemException.forbidden("SELF_REACTION", "Members cannot react to their own post");
        }

        PostReaction reaction = reactionRepository.findByMemberIdAndPostId(memberId, post.getId()).orElse(null);
        if (reaction != null && !reaction.isDeleted()) {
            throw ProblemException.conflict("DUPLICATE_REACTION", "Member already reacted to this post");
        }
        if (reaction == null) {
            reaction = new PostReaction();
            reaction.setMember(actorLookupService.requireMember(memberId));
            reaction.setPost(post);
        } else {
            reaction.restore();
        }
        reaction.setReactionType(type);
        return PostReactionResponse.from(reactionRepository.saveAndFlush(reaction));
    }

    public PostReactionResponse update(UUID memberId, UUID reactionId, ReactionUpdateRequest request) {
        PostReaction reaction = loadOwn(memberId, reactionId);
        ReactionType type = request == null || request.reactionType() == null || request.reactionType().isBlank()
                ? reaction.getReactionType().opposite()
                : parseType(request.reactionType());
        reaction.setReactionType(type);
        return PostReactionResponse.from(reactionRepository.saveAndFlush(reaction));
    }

    public void erase(UUID memberId, UUID reactionId) {
        PostReaction reaction = loadOwn(memberId, reactionId);
        reaction.markDeleted(OffsetDateTime.now(clock));
        reactionRepository.save(reaction);
    }

    @Transactional(readOnly = true)
    public PageResponse<PostReactionResponse> searchOwn(UUID memberId, PostReactionSearchRequest request) {
        return PageResponse.from(reactionRepository.searchOwn(
                memberId,
                request.postId(),
                EnumValues.parseOptional(ReactionType.class, request.reactionType(), "INVALID_REACTION_TYPE"),
                PageQuery.of(request.page(), request.limit(), request.sortBy(), request.sortDirection(), SORT_FIELDS)
        ), PostReactionResponse::from);
    }

    @Transactional(readOnly = true)
    public PostReactionResponse getOwn(UUID memberId, UUID reactionId) {
        return PostReactionResponse.from(loadOwn(memberId, reactionId));
    }

    private PostReaction loadOwn(UUID memberId, UUID reactionId) {
        PostReaction reaction = reactionRepository.findActiveById(reactionId)
                .orElseThrow(() -> ProblemException.notFound("REACTION_NOT_FOUND", "Reaction not found"));
        if (!reaction.getMember().getId().equals(memberId)) {
            throw ProblemException.forbidden("REACTION_FORBIDDEN", "Reaction belongs to another member");
        }
        return reaction;
    }

    private static ReactionType parseType(String raw) {
        return EnumValues.parse(ReactionType.class, raw, "INVALID_REACTION_TYPE");
    }
}
