package com.discussboard.backend.modules.post.presentation;

import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.security.SecurityUtils;
import com.discussboard.backend.modules.post.application.PostReactionService;
import com.discussboard.backend.modules.post.presentation.dto.PostReactionRequest;
import com.discussboard.backend.modules.post.presentation.dto.PostReactionResponse;
import com.discussboard.backend.modules.post.presentation.dto.PostReactionSearchRequest;
import com.discussboard.backend.modules.post.presentation.dto.ReactionUpdateRequest;

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
@RequestMapping("/discussBoard/member/postReactions")
public class PostReactionController {

    private final PostReactionService reactionService;

    public PostReactionController(PostReactionService reactionService) {
        this.reactionService = reactionService;
    }

    @PostMapping
    public ResponseEntity<PostReactionResponse> create(@Valid @RequestBody PostReactionRequest request) {
        PostReactionResponse response = reactionService.create(SecurityUtils.getCurrentMemberId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PatchMapping
    public ResponseEntity<PageResponse<PostReactionResponse>> searchOwn(
            @RequestBody PostReactionSearchRequest request
    ) {
        return ResponseEntity.ok(reactionService.searchOwn(SecurityUtils.getCurrentMemberId(), request));
    }

    @GetMapping("/{reactionId}")
    public ResponseEntity<PostReactionResponse> get(@PathVariable("reactionId") UUID reactionId) {
        return ResponseEntity.ok(reactionService.getOwn(SecurityUtils.getCurrentMemberId(), reactionId));
    }

    @PutMapping("/{reactionId}")
    public ResponseEntity<PostReactionResponse> update(@PathVariable("reactionId") UUID reactionId,
                                                       @RequestBody(required = false) ReactionUpdateRequest request) {
        return ResponseEntity.ok(reactionService.update(SecurityUtils.getCurrentMemberId(), reactionId, request));
    }

    @DeleteMapping("/{reactionId}")
    public ResponseEntity<Void> erase(@PathVariable("reactionId") UUID reactionId) {
        reactionService.erase(SecurityUtils.getCurrentMemberId(), reactionId);
        return ResponseEntity.noContent().build();
    }
}
