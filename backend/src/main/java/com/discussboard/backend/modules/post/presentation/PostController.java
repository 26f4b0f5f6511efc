package com.discussboard.backend.modules.post.presentation;

import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.security.SecurityUtils;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.post.application.PostEditHistoryService;
import com.discussboard.backend.modules.post.application.PostService;
import com.discussboard.backend.modules.post.application.PostTagService;
import com.discussboard.backend.modules.post.presentation.dto.EditHistorySearchRequest;
import com.discussboard.backend.modules.post.presentation.dto.PostCreateRequest;
import com.discussboard.backend.modules.post.presentation.dto.PostEditHistoryResponse;
import com.discussboard.backend.modules.post.presentation.dto.PostResponse;
import com.discussboard.backend.modules.post.presentation.dto.PostSearchRequest;
import com.discussboard.backend.modules.post.presentation.dto.PostSummaryResponse;
import com.discussboard.backend.modules.post.presentation.dto.PostTagRequest;
import com.discussboard.backend.modules.post.presentation.dto.PostTagResponse;
import com.discussboard.backend.modules.post.presentation.dto.PostTagSearchRequest;
import com.discussboard.backend.modules.post.presentation.dto.PostUpdateRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/discussBoard")
@Tag(name = "Posts", description = "Posts, their tag links and edit histories")
public class PostController {

    private final PostService postService;
    private final PostTagService postTagService;
    private final PostEditHistoryService editHistoryService;

    public PostController(PostService postService, PostTagService postTagService,
                          PostEditHistoryService editHistoryService) {
        this.postService = postService;
        this.postTagService = postTagService;
        this.editHistoryService = editHistoryService;
    }

    @Operation(summary = "Create a post together with its tag links")
    @PostMapping("/member/posts")
    public ResponseEntity<PostResponse> create(@Valid @RequestBody PostCreateRequest request) {
        PostResponse response = postService.create(SecurityUtils.getCurrentMemberId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PatchMapping("/posts")
    public ResponseEntity<PageResponse<PostSummaryResponse>> search(@RequestBody PostSearchRequest request) {
        return ResponseEntity.ok(postService.search(request));
    }

    @GetMapping("/posts/{postId}")
    public ResponseEntity<PostResponse> get(@PathVariable("postId") UUID postId) {
        return ResponseEntity.ok(postService.get(postId));
    }

    @PutMapping("/member/posts/{postId}")
    public ResponseEntity<PostResponse> updateOwn(@PathVariable("postId") UUID postId,
                                                  @Valid @RequestBody PostUpdateRequest request) {
        return ResponseEntity.ok(postService.updateAsAuthor(SecurityUtils.getCurrentMemberId(), postId, request));
    }

    @DeleteMapping("/member/posts/{postId}")
    public ResponseEntity<Void> eraseOwn(@PathVariable("postId") UUID postId) {
        postService.eraseAsAuthor(SecurityUtils.getCurrentMemberId(), postId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/moderator/posts/{postId}")
    public ResponseEntity<PostResponse> updateAsModerator(@PathVariable("postId") UUID postId,
                                                          @Valid @RequestBody PostUpdateRequest request) {
        return ResponseEntity.ok(postService.updateAsStaff(ActorType.MODERATOR, SecurityUtils.getCurrentMemberId(),
                postId, request));
    }

    @PutMapping("/administrator/posts/{postId}")
    public ResponseEntity<PostResponse> updateAsAdministrator(@PathVariable("postId") UUID postId,
                                                              @Valid @RequestBody PostUpdateRequest request) {
        return ResponseEntity.ok(postService.updateAsStaff(ActorType.ADMINISTRATOR,
                SecurityUtils.getCurrentMemberId(), postId, request));
    }

    @DeleteMapping("/moderator/posts/{postId}")
    public ResponseEntity<Void> eraseAsModerator(@PathVariable("postId") UUID postId) {
        postService.eraseAsModerator(SecurityUtils.getCurrentMemberId(), postId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/member/posts/{postId}/tags")
    public ResponseEntity<PostTagResponse> addOwnTag(@PathVariable("postId") UUID postId,
                                                     @Valid @RequestBody PostTagRequest request) {
        return addTag(ActorType.MEMBER, postId, request);
    }

    @PostMapping("/moderator/posts/{postId}/tags")
    public ResponseEntity<PostTagResponse> addTagAsModerator(@PathVariable("postId") UUID postId,
                                                             @Valid @RequestBody PostTagRequest request) {
        return addTag(ActorType.MODERATOR, postId, request);
    }

    @PostMapping("/administrator/posts/{postId}/tags")
    public ResponseEntity<PostTagResponse> addTagAsAdministrator(@PathVariable("postId") UUID postId,
                                                                 @Valid @RequestBody PostTagRequest request) {
        return addTag(ActorType.ADMINISTRATOR, postId, request);
    }

    @PatchMapping("/posts/{postId}/tags")
    public ResponseEntity<PageResponse<PostTagResponse>> listTags(@PathVariable("postId") UUID postId,
                                                                  @RequestBody PostTagSearchRequest request) {
        return ResponseEntity.ok(postTagService.list(postId, request));
    }

    @DeleteMapping("/member/posts/{postId}/tags/{tagId}")
    public ResponseEntity<Void> removeOwnTag(@PathVariable("postId") UUID postId,
                                             @PathVariable("tagId") UUID tagId) {
        postTagService.remove(ActorType.MEMBER, SecurityUtils.getCurrentMemberId(), postId, tagId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/moderator/posts/{postId}/tags/{tagId}")
    public ResponseEntity<Void> removeTagAsModerator(@PathVariable("postId") UUID postId,
                                                     @PathVariable("tagId") UUID tagId) {
        postTagService.remove(ActorType.MODERATOR, SecurityUtils.getCurrentMemberId(), postId, tagId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/posts/{postId}/editHistories")
    public ResponseEntity<PageResponse<PostEditHistoryResponse>> searchEditHistories(
            @PathVariable("postId") UUID postId,
            @RequestBody EditHistorySearchRequest request
    ) {
        return ResponseEntity.ok(editHistoryService.search(postId, request));
    }

    @GetMapping("/posts/{postId}/editHistories/{historyId}")
    public ResponseEntity<PostEditHistoryResponse> getEditHistory(@PathVariable("postId") UUID postId,
                                                                  @PathVariable("historyId") UUID historyId) {
        return ResponseEntity.ok(editHistoryService.get(postId, historyId));
    }

    private ResponseEntity<PostTagResponse> addTag(ActorType actorType, UUID postId, PostTagRequest request) {
        PostTagResponse response = postTagService.add(actorType, SecurityUtils.getCurrentMemberId(), postId,
                request.tagId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
