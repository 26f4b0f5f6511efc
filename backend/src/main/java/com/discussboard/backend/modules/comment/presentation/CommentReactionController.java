package com.discussboard.backend.modules.comment.presentation;

import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.security.SecurityUtils;
import com.discussboard.backend.modules.comment.application.CommentReactionService;
import com.discussboard.backend.modules.comment.presentation.dto.CommentReactionRequest;
import com.discussboard.backend.modules.comment.presentation.dto.CommentReactionResponse;
import com.discussboard.backend.modules.comment.presentation.dto.CommentReactionSearchRequest;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/discussBoard/member/commentReactions")
public class CommentReactionController {

    private final CommentReactionService reactionService;

    public CommentReactionController(CommentReactionService reactionService) {
        this.reactionService = reactionService;
    }

    @PostMapping
    public ResponseEntity<CommentReactionResponse> create(@Valid @RequestBody CommentReactionRequest request) {
        CommentReactionResponse response = reactionService.create(SecurityUtils.getCurrentMemberId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PatchMapping
    public ResponseEntity<PageResponse<CommentReactionResponse>> searchOwn(
            @RequestBody CommentReactionSearchRequest request
    ) {
        return ResponseEntity.ok(reactionService.searchOwn(SecurityUtils.getCurrentMemberId(), request));
    }

    @GetMapping("/{reactionId}")
    public ResponseEntity<CommentReactionResponse> get(@PathVariable("reactionId") UUID reactionId) {
        return ResponseEntity.ok(reactionService.getOwn(SecurityUtils.getCurrentMemberId(), reactionId));
    }

    @DeleteMapping("/{reactionId}")
    public ResponseEntity<Void> erase(@PathVariable("reactionId") UUID reactionId) {
        reactionService.erase(SecurityUtils.getCurrentMemberId(), reactionId);
        return ResponseEntity.noContent().build();
    }
}
