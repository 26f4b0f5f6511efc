package com.discussboard.backend.modules.comment.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.EnumValues;
import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.comment.domain.Comment;
import com.discussboard.backend.modules.comment.domain.CommentReaction;
import com.discussboard.backend.modules.comment.infrastructure.persistence.CommentReactionRepository;
import com.discussboard.backend.modules.comment.presentation.dto.CommentReactionRequest;
import com.discussboard.backend.modules.comment.presentation.dto.CommentReactionResponse;
import com.discussboard.backend.modules.comment.presentation.dto.CommentReactionSearchRequest;
import com.discussboard.backend.modules.post.domain.ReactionType;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class CommentReactionService {

    static final Set<String> SORT_FIELDS = Set.of("createdAt", "updatedAt");

    private final CommentReactionRepository reactionRepository;
    private final CommentService commentService;
    private final ActorLookupService actorLookupService;
    private final Clock clock;

    public CommentReactionService(
            CommentReactionRepository reactionRepository,
            CommentService commentService,
            ActorLookupService actorLookupService,
            Clock clock
    ) {
        this.reactionRepository = reactionRepository;
        this.commentService = commentService;
        this.actorLookupService = actorLookupService;
        this.clock = clock;
    }

    public CommentReactionResponse create(UUID memberId, CommentReactionRequest request) {
        ReactionType type = EnumValues.parse(ReactionType.class, request.reactionType(), "INVALID_REACTION_TYPE");
        Comment comment = commentService.loadActive(request.commentId());
        if (comment.isLocked()) {
            throw ProblemException.conflict("COMMENT_LOCKED", "Comment is locked");
        }
        if (comment.isAuthoredBy(memberId)) {
            throw ProblemException.forbidden("SELF_REACTION", "Members cannot react to their own comment");
        }

        CommentReaction reaction = reactionRepository.findByMemberIdAndCommentId(memberId, comment.getId())
                .orElse(null);
        if (reaction != null && !reaction.isDeleted()) {
            throw ProblemException.conflict("DUPLICATE_REACTION", "Member already reacted to this comment");
        }
        if (reaction == null) {
            reaction = new CommentReaction();
            reaction.setMember(actorLookupService.requireMember(memberId));
            reaction.setComment(comment);
        } else {
            reaction.restore();
        }
        reaction.setReactionType(type);
        return CommentReactionResponse.from(reactionRepository.saveAndFlush(reaction));
    }

    @Transactional(readOnly = true)
    public PageResponse<CommentReactionResponse> searchOwn(UUID memberId, CommentReactionSearchRequest request) {
        return PageResponse.from(reactionRepository.searchOwn(
                memberId,
                request.commentId(),
                EnumValues.parseOptional(ReactionType.class, request.reactionType(), "INVALID_REACTION_TYPE"),
                PageQuery.of(request.page(), request.limit(), request.sortBy(), request.sortDirection(), SORT_FIELDS)
        ), CommentReactionResponse::from);
    }

    @Transactional(readOnly = true)
    public CommentReactionResponse getOwn(UUID memberId, UUID reactionId) {
        return CommentReactionResponse.from(loadOwn(memberId, reactionId));
    }

    public void erase(UUID memberId, UUID reactionId) {
        CommentReaction reaction = loadOwn(memberId, reactionId);
        reaction.markDeleted(OffsetDateTime.now(clock));
        reactionRepository.save(reaction);
    }

    private CommentReaction loadOwn(UUID memberId, UUID reactionId) {
        CommentReaction reaction = reactionRepository.findActiveById(reactionId)
                .orElseThrow(() -> ProblemException.notFound("REACTION_NOT_FOUND", "Reaction not found"));
        if (!reaction.getMember().getId().equals(memberId)) {
            throw ProblemException.forbidden("REACTION_FORBIDDEN", "Reaction belongs to another member");
        }
        return reaction;
    }
}
