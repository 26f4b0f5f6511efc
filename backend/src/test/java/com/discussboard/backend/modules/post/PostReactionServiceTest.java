package com.discussboard.backend.modules.post;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.application.ActorLookupService;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.post.application.PostReactionService;
import com.discussboard.backend.modules.post.application.PostService;
import com.discussboard.backend.modules.post.domain.Post;
import com.discussboard.backend.modules.post.domain.PostReaction;
import com.discussboard.backend.modules.post.domain.ReactionType;
import com.discussboard.backend.modules.post.infrastructure.persistence.PostReactionRepository;
import com.discussboard.backend.modules.post.presentation.dto.PostReactionRequest;
import com.discussboard.backend.modules.post.presentation.dto.PostReactionResponse;
import com.discussboard.backend.modules.post.presentation.dto.ReactionUpdateRequest;
import com.discussboard.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PostReactionServiceTest {

    @Mock
    private PostReactionRepository reactionRepository;
    @Mock
    private PostService postService;
    @Mock
    private ActorLookupService actorLookupService;

    private PostReactionService reactionService;
    private Clock clock;
    private Member author;
    private Member reader;
    private Post post;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        reactionService = new PostReactionService(reactionRepository, postService, actorLookupService, clock);
        author = TestEntities.member("alice");
        reader = TestEntities.member("bob");
        post = TestEntities.post(author, "Hello");

        lenient().when(postService.loadActive(post.getId())).thenReturn(post);
        lenient().when(actorLookupService.requireMember(reader.getId())).thenReturn(reader);
        lenient().when(reactionRepository.saveAndFlush(any(PostReaction.class)))
                .thenAnswer(inv -> TestEntities.withId(inv.getArgument(0), UUID.randomUUID()));
    }

    private PostReaction existing(ReactionType type) {
        PostReaction reaction = TestEntities.withId(new PostReaction(), UUID.randomUUID());
        reaction.setMember(reader);
        reaction.setPost(post);
        reaction.setReactionType(type);
        return reaction;
    }

    @Test
    void authorsCannotReactToTheirOwnPost() {
        assertThatThrownBy(() -> reactionService.create(author.getId(), new PostReactionRequest(post.getId(), "like")))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("SELF_REACTION");
    }

    @Test
    void secondActiveReactionConflicts() {
        when(reactionRepository.findByMemberIdAndPostId(reader.getId(), post.getId()))
                .thenReturn(Optional.of(existing(ReactionType.LIKE)));

        assertThatThrownBy(() -> reactionService.create(reader.getId(), new PostReactionRequest(post.getId(), "dislike")))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("DUPLICATE_REACTION");
    }

    @Test
    void previouslyWithdrawnReactionIsRevived() {
        PostReaction withdrawn = existing(ReactionType.LIKE);
        withdrawn.markDeleted(OffsetDateTime.now(clock).minusDays(1));
        when(reactionRepository.findByMemberIdAndPostId(reader.getId(), post.getId()))
                .thenReturn(Optional.of(withdrawn));

        PostReactionResponse response = reactionService.create(reader.getId(),
                new PostReactionRequest(post.getId(), "dislike"));

        assertThat(withdrawn.isDeleted()).isFalse();
        assertThat(response.id()).isEqualTo(withdrawn.getId());
        assertThat(response.reactionType()).isEqualTo("dislike");
    }

    @Test
    void updateWithoutTypeFlipsTheReaction() {
        PostReaction reaction = existing(ReactionType.LIKE);
        when(reactionRepository.findActiveById(reaction.getId())).thenReturn(Optional.of(reaction));

        reactionService.update(reader.getId(), reaction.getId(), null);
        assertThat(reaction.getReactionType()).isEqualTo(ReactionType.DISLIKE);

        reactionService.update(reader.getId(), reaction.getId(), new ReactionUpdateRequest("dislike"));
        assertThat(reaction.getReactionType()).isEqualTo(ReactionType.DISLIKE);
    }

    @Test
    void othersCannotReadOrDeleteAReaction() {
        PostReaction reaction = existing(ReactionType.LIKE);
        when(reactionRepository.findActiveById(reaction.getId())).thenReturn(Optional.of(reaction));

        assertThatThrownBy(() -> reactionService.erase(author.getId(), reaction.getId()))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("REACTION_FORBIDDEN");
        assertThat(reaction.isDeleted()).isFalse();
    }
}
