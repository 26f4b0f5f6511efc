package com.discussboard.backend.modules.comment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.comment.application.CommentService;
import com.discussboard.backend.modules.comment.domain.Comment;
import com.discussboard.backend.modules.comment.domain.CommentEditHistory;
import com.discussboard.backend.modules.comment.infrastructure.persistence.CommentEditHistoryRepository;
import com.discussboard.backend.modules.comment.infrastructure.persistence.CommentRepository;
import com.discussboard.backend.modules.comment.presentation.dto.CommentCreateRequest;
import com.discussboard.backend.modules.comment.presentation.dto.CommentResponse;
import com.discussboard.backend.modules.comment.presentation.dto.CommentUpdateRequest;
import com.discussboard.backend.modules.notification.application.NotificationService;
import com.discussboard.backend.modules.platform.application.ForbiddenWordService;
import com.discussboard.backend.modules.post.application.PostService;
import com.discussboard.backend.modules.post.domain.Post;
import com.discussboard.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class CommentServiceTest {

    @Mock
    private CommentRepository commentRepository;
    @Mock
    private CommentEditHistoryRepository editHistoryRepository;
    @Mock
    private PostService postService;
    @Mock
    private ActorLookupService actorLookupService;
    @Mock
    private ForbiddenWordService forbiddenWordService;
    @Mock
    private NotificationService notificationService;

    private CommentService commentService;
    private Member postAuthor;
    private Member commenter;
    private Post post;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        commentService = new CommentService(commentRepository, editHistoryRepository, postService, actorLookupService,
                forbiddenWordService, notificationService, clock);
        postAuthor = TestEntities.member("alice");
        commenter = TestEntities.member("bob");
        post = TestEntities.post(postAuthor, "Hello");

        lenient().when(postService.loadActive(post.getId())).thenReturn(post);
        lenient().when(actorLookupService.requireMember(commenter.getId())).thenReturn(commenter);
        lenient().when(actorLookupService.requireMember(postAuthor.getId())).thenReturn(postAuthor);
        lenient().when(commentRepository.save(any(Comment.class)))
                .thenAnswer(inv -> TestEntities.withId(inv.getArgument(0), UUID.randomUUID()));
        lenient().when(commentRepository.saveAndFlush(any(Comment.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private Comment comment(Member author, int depth) {
        Comment comment = TestEntities.withId(new Comment(), UUID.randomUUID());
        comment.setPost(post);
        comment.setAuthor(author);
        comment.setContent("original");
        comment.setDepth(depth);
        return comment;
    }

    @Test
    @DisplayName("a comment by someone else notifies the post author")
    void notifiesPostAuthor() {
        CommentResponse response = commentService.create(commenter.getId(), post.getId(),
                new CommentCreateRequest("Nice post", null));

        assertThat(response.depth()).isZero();
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(notificationService).notify(eq(postAuthor.getUserAccount().getId()),
                eq(NotificationService.EVENT_COMMENT_CREATED), anyString(), body.capture());
        assertThat(body.getValue()).isEqualTo("bob: Nice post");
    }

    @Test
    void authorsOwnCommentSendsNoNotification() {
        commentService.create(postAuthor.getId(), post.getId(), new CommentCreateRequest("Thanks all", null));

        verify(notificationService, never()).notify(any(), any(), any(), any());
    }

    @Test
    void repliesNestOneLevelBelowTheirParent() {
        Comment parent = comment(postAuthor, 2);
        when(commentRepository.findActiveByIdAndPostId(parent.getId(), post.getId())).thenReturn(Optional.of(parent));

        CommentResponse reply = commentService.create(commenter.getId(), post.getId(),
                new CommentCreateRequest("reply", parent.getId()));

        assertThat(reply.depth()).isEqualTo(3);
        assertThat(reply.parentId()).isEqualTo(parent.getId());
    }

    @Test
    void replyBeyondMaximumDepthIsUnprocessable() {
        Comment parent = comment(postAuthor, Comment.MAX_DEPTH);
        when(commentRepository.findActiveByIdAndPostId(parent.getId(), post.getId())).thenReturn(Optional.of(parent));

        assertThatThrownBy(() -> commentService.create(commenter.getId(), post.getId(),
                new CommentCreateRequest("too deep", parent.getId())))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getStatusCode())
                        .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY))
                .extracting("code")
                .isEqualTo("COMMENT_TOO_DEEP");
    }

    @Test
    void parentOnAnotherPostIsNotFound() {
        UUID foreignParent = UUID.randomUUID();
        when(commentRepository.findActiveByIdAndPostId(foreignParent, post.getId())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> commentService.create(commenter.getId(), post.getId(),
                new CommentCreateRequest("reply", foreignParent)))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("PARENT_COMMENT_NOT_FOUND");
    }

    @Test
    void editKeepsThePreviousContent() {
        Comment comment = comment(commenter, 0);
        when(commentRepository.findActiveByIdAndPostId(comment.getId(), post.getId())).thenReturn(Optional.of(comment));

        CommentResponse response = commentService.update(commenter.getId(), post.getId(), comment.getId(),
                new CommentUpdateRequest("edited", "clarify"));

        assertThat(response.content()).isEqualTo("edited");
        ArgumentCaptor<CommentEditHistory> history = ArgumentCaptor.forClass(CommentEditHistory.class);
        verify(editHistoryRepository).save(history.capture());
        assertThat(history.getValue().getPreviousContent()).isEqualTo("original");
    }

    @Test
    void lockedCommentCannotBeEdited() {
        Comment comment = comment(commenter, 0);
        comment.setLocked(true);
        when(commentRepository.findActiveByIdAndPostId(comment.getId(), post.getId())).thenReturn(Optional.of(comment));

        assertThatThrownBy(() -> commentService.update(commenter.getId(), post.getId(), comment.getId(),
                new CommentUpdateRequest("edited", null)))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("COMMENT_LOCKED");
    }

    @Test
    void onlyTheAuthorMayDelete() {
        Comment comment = comment(commenter, 0);
        when(commentRepository.findActiveByIdAndPostId(comment.getId(), post.getId())).thenReturn(Optional.of(comment));

        assertThatThrownBy(() -> commentService.erase(postAuthor.getId(), post.getId(), comment.getId()))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("NOT_COMMENT_AUTHOR");
        assertThat(comment.isDeleted()).isFalse();
    }
}
