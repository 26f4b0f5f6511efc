package com.discussboard.backend.modules.post;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.post.application.PostService;
import com.discussboard.backend.modules.post.application.PostTagService;
import com.discussboard.backend.modules.post.domain.Post;
import com.discussboard.backend.modules.post.domain.PostTag;
import com.discussboard.backend.modules.post.infrastructure.persistence.PostTagRepository;
import com.discussboard.backend.modules.post.presentation.dto.PostTagResponse;
import com.discussboard.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PostTagServiceTest {

    @Mock
    private PostService postService;
    @Mock
    private PostTagRepository postTagRepository;

    private PostTagService postTagService;
    private Member author;
    private Post post;

    @BeforeEach
    void setUp() {
        postTagService = new PostTagService(postService, postTagRepository);
        author = TestEntities.member("alice");
        post = TestEntities.post(author, "Tagged");
        when(postService.loadActive(post.getId())).thenReturn(post);
    }

    @Test
    void linkingTheSameTagTwiceConflicts() {
        UUID tagId = UUID.randomUUID();
        when(postTagRepository.existsByPostIdAndTagId(post.getId(), tagId)).thenReturn(true);

        assertThatThrownBy(() -> postTagService.add(ActorType.MEMBER, author.getId(), post.getId(), tagId))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("DUPLICATE_POST_TAG");
        verify(postTagRepository, never()).save(any(PostTag.class));
    }

    @Test
    void authorLinksNewTag() {
        UUID tagId = UUID.randomUUID();
        when(postTagRepository.existsByPostIdAndTagId(post.getId(), tagId)).thenReturn(false);
        when(postTagRepository.save(any(PostTag.class))).thenAnswer(inv -> inv.getArgument(0));

        PostTagResponse response = postTagService.add(ActorType.MEMBER, author.getId(), post.getId(), tagId);

        assertThat(response.tagId()).isEqualTo(tagId);
    }

    @Test
    void otherMembersCannotTagThePost() {
        assertThatThrownBy(() -> postTagService.add(ActorType.MEMBER, UUID.randomUUID(), post.getId(),
                UUID.randomUUID()))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("NOT_POST_AUTHOR");
    }

    @Test
    void removingAMissingLinkIsNotFound() {
        UUID tagId = UUID.randomUUID();
        UUID moderatorId = UUID.randomUUID();
        when(postTagRepository.findByPostIdAndTagId(post.getId(), tagId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> postTagService.remove(ActorType.MODERATOR, moderatorId, post.getId(), tagId))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("POST_TAG_NOT_FOUND");
        verify(postService).requireStaff(ActorType.MODERATOR, moderatorId);
        verify(postTagRepository, never()).delete(any(PostTag.class));
    }
}
