package com.discussboard.backend.modules.comment.presentation;

import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.security.SecurityUtils;
import com.discussboard.backend.modules.comment.application.CommentService;
import com.discussboard.backend.modules.comment.presentation.dto.CommentCreateRequest;
import com.discussboard.backend.modules.comment.presentation.dto.CommentEditHistoryResponse;
import com.discussboard.backend.modules.comment.presentation.dto.CommentResponse;
import com.discussboard.backend.modules.comment.presentation.dto.CommentSearchRequest;
import com.discussboard.backend.modules.comment.presentation.dto.CommentUpdateRequest;
import com.discussboard.backend.modules.post.presentation.dto.EditHistorySearchRequest;

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
@Tag(name = "Comments", description = "Threaded comments on posts")
public class CommentController {

    private final CommentService commentService;

    public CommentController(CommentService commentService) {
        this.commentService = commentService;
    }

    @Operation(summary = "Comment on a post or reply to a comment")
    @PostMapping("/member/posts/{postId}/comments")
    public ResponseEntity<CommentResponse> create(@PathVariable("postId") UUID postId,
                                                  @Valid @RequestBody CommentCreateRequest request) {
        CommentResponse response = commentService.create(SecurityUtils.getCurrentMemberId(), postId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PatchMapping("/posts/{postId}/comments")
    public ResponseEntity<PageResponse<CommentResponse>> search(@PathVariable("postId") UUID postId,
                                                                @RequestBody CommentSearchRequest request) {
        return ResponseEntity.ok(commentService.search(postId, request));
    }

    @GetMapping("/posts/{postId}/comments/{commentId}")
    public ResponseEntity<CommentResponse> get(@PathVariable("postId") UUID postId,
                                               @PathVariable("commentId") UUID commentId) {
        return ResponseEntity.ok(commentService.get(postId, commentId));
    }

    @PutMapping("/member/posts/{postId}/comments/{commentId}")
    public ResponseEntity<CommentResponse> update(@PathVariable("postId") UUID postId,
                                                  @PathVariable("commentId") UUID commentId,
                                                  @Valid @RequestBody CommentUpdateRequest request) {
        return ResponseEntity.ok(
                commentService.update(SecurityUtils.getCurrentMemberId(), postId, commentId, request));
    }

    @DeleteMapping("/member/posts/{postId}/comments/{commentId}")
    public ResponseEntity<Void> erase(@PathVariable("postId") UUID postId,
                                      @PathVariable("commentId") UUID commentId) {
        commentService.erase(SecurityUtils.getCurrentMemberId(), postId, commentId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/member/posts/{postId}/comments/{commentId}/editHistories")
    public ResponseEntity<PageResponse<CommentEditHistoryResponse>> searchEditHistories(
            @PathVariable("postId") UUID postId,
            @PathVariable("commentId") UUID commentId,
            @RequestBody EditHistorySearchRequest request
    ) {
        return ResponseEntity.ok(commentService.searchEditHistories(postId, commentId, request));
    }

    @GetMapping("/member/posts/{postId}/comments/{commentId}/editHistories/{historyId}")
    public ResponseEntity<CommentEditHistoryResponse> getEditHistory(@PathVariable("postId") UUID postId,
                                                                     @PathVariable("commentId") UUID commentId,
                                                                     @PathVariable("historyId") UUID historyId) {
        return ResponseEntity.ok(commentService.getEditHistory(postId, commentId, historyId));
    }
}
