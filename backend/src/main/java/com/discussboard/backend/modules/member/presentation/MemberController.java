package com.discussboard.backend.modules.member.presentation;

import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.security.SecurityUtils;
import com.discussboard.backend.modules.member.application.MemberService;
import com.discussboard.backend.modules.member.presentation.dto.MemberCreateRequest;
import com.discussboard.backend.modules.member.presentation.dto.MemberProfileResponse;
import com.discussboard.backend.modules.member.presentation.dto.MemberProfileUpdateRequest;
import com.discussboard.backend.modules.member.presentation.dto.MemberResponse;
import com.discussboard.backend.modules.member.presentation.dto.MemberSearchRequest;
import com.discussboard.backend.modules.member.presentation.dto.MemberUpdateRequest;

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
@Tag(name = "Members", description = "Member profiles and administrator member management")
public class MemberController {

    private final MemberService memberService;

    public MemberController(MemberService memberService) {
        this.memberService = memberService;
    }

    @Operation(summary = "Public profile of a member")
    @GetMapping("/members/{memberId}/profile")
    public ResponseEntity<MemberProfileResponse> getProfile(@PathVariable("memberId") UUID memberId) {
        return ResponseEntity.ok(memberService.getProfile(memberId));
    }

    @PutMapping("/member/members/{memberId}/profile")
    public ResponseEntity<MemberProfileResponse> updateOwnProfile(
            @PathVariable("memberId") UUID memberId,
            @Valid @RequestBody MemberProfileUpdateRequest request
    ) {
        return ResponseEntity.ok(memberService.updateOwnProfile(SecurityUtils.getCurrentMemberId(), memberId, request));
    }

    @PatchMapping("/administrator/members")
    public ResponseEntity<PageResponse<MemberResponse>> search(@RequestBody MemberSearchRequest request) {
        return ResponseEntity.ok(memberService.search(request));
    }

    @GetMapping("/administrator/members/{memberId}")
    public ResponseEntity<MemberResponse> get(@PathVariable("memberId") UUID memberId) {
        return ResponseEntity.ok(memberService.get(memberId));
    }

    @PostMapping("/administrator/members")
    public ResponseEntity<MemberResponse> create(@Valid @RequestBody MemberCreateRequest request) {
        MemberResponse response = memberService.create(SecurityUtils.getCurrentMemberId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/administrator/members/{memberId}")
    public ResponseEntity<MemberResponse> update(@PathVariable("memberId") UUID memberId,
                                                 @Valid @RequestBody MemberUpdateRequest request) {
        return ResponseEntity.ok(memberService.update(SecurityUtils.getCurrentMemberId(), memberId, request));
    }

    @DeleteMapping("/administrator/members/{memberId}")
    public ResponseEntity<Void> erase(@PathVariable("memberId") UUID memberId) {
        memberService.erase(SecurityUtils.getCurrentMemberId(), memberId);
        return ResponseEntity.noContent().build();
    }
}
