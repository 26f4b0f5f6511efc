package com.discussboard.backend.modules.post.application;

import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.post.domain.Post;
import com.discussboard.backend.modules.post.domain.PostTag;
import com.discussboard.backend.modules.post.infrastructure.persistence.PostTagRepository;
import com.discussboard.backend.modules.post.presentation.dto.PostTagResponse;
import com.discussboard.backend.modules.post.presentation.dto.PostTagSearchRequest;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class PostTagService {

    private final PostService postService;
    private final PostTagRepository postTagRepository;

    public PostTagService(PostService postService, PostTagRepository postTagRepository) {
        this.postService = postService;
        this.postTagRepository = postTagRepository;
    }

    /**
     * Links a tag. Members may only tag their own posts; moderators and administrators may tag any.
     */
    public PostTagResponse add(ActorType actorType, UUID actorMemberId, UUID postId, UUID tagId) {
        Post post = loadFor(actorType, actorMemberId, postId);
        if (postTagRepository.existsByPostIdAndTagId(post.getId(), tagId)) {
            throw ProblemException.conflict("DUPLICATE_POST_TAG", "Tag is already linked to the post");
        }
        return PostTagResponse.from(postTagRepository.save(new PostTag(post, tagId)));
    }

    @Transactional(readOnly = true)
    public PageResponse<PostTagResponse> list(UUID postId, PostTagSearchRequest request) {
        Post post = postService.loadActive(postId);
        return PageResponse.from(postTagRepository.findByPostId(
                post.getId(),
                PageQuery.of(request.page(), request.limit(), "createdAt", request.sortDirection(),
                        Set.of("createdAt"))
        ), PostTagResponse::from);
    }

    public void remove(ActorType actorType, UUID actorMemberId, UUID postId, UUID tagId) {
        Post post = loadFor(actorType, actorMemberId, postId);
        PostTag link = postTagRepository.findByPostIdAndTagId(post.getId(), tagId)
                .orElseThrow(() -> ProblemException.notFound("POST_TAG_NOT_FOUND", "Tag is not linked to the post"));
        postTagRepository.delete(link);
    }

    private Post loadFor(ActorType actorType, UUID actorMemberId, UUID postId) {
        if (actorType != ActorType.MEMBER) {
            postService.requireStaff(actorType, actorMemberId);
        }
        Post post = postService.loadActive(postId);
        if (actorType == ActorType.MEMBER) {
            PostService.requireAuthor(post, actorMemberId);
        }
        return post;
    }
}
