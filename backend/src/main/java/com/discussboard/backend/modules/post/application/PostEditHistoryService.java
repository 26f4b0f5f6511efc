package com.discussboard.backend.modules.post.application;

import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.post.infrastructure.persistence.PostEditHistoryRepository;
import com.discussboard.backend.modules.post.presentation.dto.EditHistorySearchRequest;
import com.discussboard.backend.modules.post.presentation.dto.PostEditHistoryResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class PostEditHistoryService {

    private final PostService postService;
    private final PostEditHistoryRepository editHistoryRepository;

    public PostEditHistoryService(PostService postService, PostEditHistoryRepository editHistoryRepository) {
        this.postService = postService;
        this.editHistoryRepository = editHistoryRepository;
    }

    public PageResponse<PostEditHistoryResponse> search(UUID postId, EditHistorySearchRequest request) {
        postService.loadActive(postId);
        return PageResponse.from(editHistoryRepository.search(
                postId,
                request.editorMemberId(),
                PageQuery.of(request.page(), request.limit(), "createdAt", request.sortDirection(),
                        Set.of("createdAt"))
        ), PostEditHistoryResponse::from);
    }

    public PostEditHistoryResponse get(UUID postId, UUID historyId) {
        postService.loadActive(postId);
        return editHistoryRepository.findByIdAndPostId(historyId, postId)
                .map(PostEditHistoryResponse::from)
                .orElseThrow(() -> ProblemException.notFound("EDIT_HISTORY_NOT_FOUND", "Edit history not found"));
    }
}
