package com.discussboard.backend.modules.comment.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.comment.domain.Comment;
import com.discussboard.backend.modules.comment.domain.CommentEditHistory;
import com.discussboard.backend.modules.comment.infrastructure.persistence.CommentEditHistoryRepository;
import com.discussboard.backend.modules.comment.infrastructure.persistence.CommentRepository;
import com.discussboard.backend.modules.comment.presentation.dto.CommentCreateRequest;
import com.discussboard.backend.modules.comment.presentation.dto.CommentEditHistoryResponse;
import com.discussboard.backend.modules.comment.presentation.dto.CommentResponse;
import com.discussboard.backend.modules.comment.presentation.dto.CommentSearchRequest;
import com.discussboard.backend.modules.comment.presentation.dto.CommentUpdateRequest;
import com.discussboard.backend.modules.notification.application.NotificationService;
import com.discussboard.backend.modules.platform.application.ForbiddenWordService;
import com.discussboard.backend.modules.post.application.PostService;
import com.discussboard.backend.modules.post.domain.Post;
import com.discussboard.backend.modules.post.presentation.dto.EditHistorySearchRequest;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class CommentService {

    static final Set<String> SORT_FIELDS = Set.of("createdAt", "updatedAt");
    private static final int NOTIFICATION_PREVIEW_LENGTH = 200;

    private final CommentRepository commentRepository;
    private final CommentEditHistoryRepository editHistoryRepository;
    private final PostService postService;
    private final ActorLookupService actorLookupService;
    private final ForbiddenWordService forbiddenWordService;
    private final NotificationService notificationService;
    private final Clock clock;

    public CommentService(
            CommentRepository commentRepository,
            CommentEditHistoryRepository editHistoryRepository,
            PostService postService,
            ActorLookupService actorLookupService,
            ForbiddenWordService forbiddenWordService,
            NotificationService notificationService,
            Clock clock
    ) {
        this.commentRepository = commentRepository;
        this.editHistoryRepository = editHistoryRepository;
        this.postService = postService;
        this.actorLookupService = actorLookupService;
        this.forbiddenWordService = forbiddenWordService;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    public CommentResponse create(UUID authorMemberId, UUID postId, CommentCreateRequest request) {
        Post post = postService.loadActive(postId);
        Member author = actorLookupService.requireMember(authorMemberId);

        Comment comment = new Comment();
        comment.setPost(post);
        comment.setAuthor(author);
        if (request.parentId() != null) {
            Comment parent = commentRepository.findActiveByIdAndPostId(request.parentId(), post.getId())
                    .orElseThrow(() -> ProblemException.notFound("PARENT_COMMENT_NOT_FOUND",
                            "Parent comment not found on this post"));
            if (parent.getDepth() + 1 > Comment.MAX_DEPTH) {
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "COMMENT_TOO_DEEP",
                        "Replies may be nested at most " + Comment.MAX_DEPTH + " levels");
            }
            comment.setParent(parent);
            comment.setDepth(parent.getDepth() + 1);
        }
        forbiddenWordService.assertClean(request.content());
        comment.setContent(request.content());
        comment = commentRepository.save(comment);

        if (!post.isAuthoredBy(authorMemberId)) {
            notificationService.notify(
                    post.getAuthor().getUserAccount().getId(),
                    NotificationService.EVENT_COMMENT_CREATED,
                    "New comment on \"" + post.getTitle() + "\"",
                    preview(author.getNickname() + ": " + comment.getContent())
            );
        }
        return CommentResponse.from(comment);
    }

    @Transactional(readOnly = true)
    public PageResponse<CommentResponse> search(UUID postId, CommentSearchRequest request) {
        Post post = postService.loadActive(postId);
        return PageResponse.from(commentRepository.search(
                post.getId(),
                request.authorId(),
                request.parentId(),
                PageQuery.likePattern(request.keyword()),
                PageQuery.of(request.page(), request.limit(), request.sortBy(), request.sortDirection(), SORT_FIELDS)
        ), CommentResponse::from);
    }

    @Transactional(readOnly = true)
    public CommentResponse get(UUID postId, UUID commentId) {
        return CommentResponse.from(loadOnPost(postId, commentId));
    }

    public CommentResponse update(UUID memberId, UUID postId, UUID commentId, CommentUpdateRequest request) {
        Comment comment = loadOnPost(postId, commentId);
        requireAuthor(comment, memberId);
        if (comment.isLocked()) {
            throw ProblemException.conflict("COMMENT_LOCKED", "Comment is locked");
        }
        forbiddenWordService.assertClean(request.content());

        CommentEditHistory history = new CommentEditHistory();
        history.setComment(comment);
        history.setEditor(comment.getAuthor());
        history.setPreviousContent(comment.getContent());
        history.setEditReason(request.editReason());
        editHistoryRepository.save(history);

        comment.setContent(request.content());
        return CommentResponse.from(commentRepository.saveAndFlush(comment));
    }

    public void erase(UUID memberId, UUID postId, UUID commentId) {
        Comment comment = loadOnPost(postId, commentId);
        requireAuthor(comment, memberId);
        comment.markDeleted(OffsetDateTime.now(clock));
        commentRepository.save(comment);
    }

    @Transactional(readOnly = true)
    public PageResponse<CommentEditHistoryResponse> searchEditHistories(UUID postId, UUID commentId,
                                                                        EditHistorySearchRequest request) {
        Comment comment = loadOnPost(postId, commentId);
        return PageResponse.from(editHistoryRepository.search(
                comment.getId(),
                request.editorMemberId(),
                PageQuery.of(request.page(), request.limit(), "createdAt", request.sortDirection(),
                        Set.of("createdAt"))
        ), CommentEditHistoryResponse::from);
    }

    @Transactional(readOnly = true)
    public CommentEditHistoryResponse getEditHistory(UUID postId, UUID commentId, UUID historyId) {
        Comment comment = loadOnPost(postId, commentId);
        return editHistoryRepository.findByIdAndCommentId(historyId, comment.getId())
                .map(CommentEditHistoryResponse::from)
                .orElseThrow(() -> ProblemException.notFound("EDIT_HISTORY_NOT_FOUND", "Edit history not found"));
    }

    public Comment loadActive(UUID commentId) {
        return commentRepository.findActiveById(commentId)
                .orElseThrow(() -> ProblemException.notFound("COMMENT_NOT_FOUND", "Comment not found"));
    }

    private Comment loadOnPost(UUID postId, UUID commentId) {
        postService.loadActive(postId);
        return commentRepository.findActiveByIdAndPostId(commentId, postId)
                .orElseThrow(() -> ProblemException.notFound("COMMENT_NOT_FOUND", "Comment not found"));
    }

    private static void requireAuthor(Comment comment, UUID memberId) {
        if (!comment.isAuthoredBy(memberId)) {
            throw ProblemException.forbidden("NOT_COMMENT_AUTHOR", "Only the author may change this comment");
        }
    }

    private static String preview(String text) {
        return text.length() <= NOTIFICATION_PREVIEW_LENGTH ? text : text.substring(0, NOTIFICATION_PREVIEW_LENGTH);
    }
}
