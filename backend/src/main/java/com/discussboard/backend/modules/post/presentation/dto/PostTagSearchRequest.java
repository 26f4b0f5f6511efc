package com.discussboard.backend.modules.post.presentation.dto;

public record PostTagSearchRequest(Integer page, Integer limit, String sortDirection) {
}
