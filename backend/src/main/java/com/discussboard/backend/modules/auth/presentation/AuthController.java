package com.discussboard.backend.modules.auth.presentation;

import com.discussboard.backend.global.security.SecurityUtils;
import com.discussboard.backend.modules.auth.application.AuthService;
import com.discussboard.backend.modules.auth.application.AuthService.ClientInfo;
import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.auth.presentation.dto.AdministratorJoinRequest;
import com.discussboard.backend.modules.auth.presentation.dto.AuthorizedActorResponse;
import com.discussboard.backend.modules.auth.presentation.dto.LoginRequest;
import com.discussboard.backend.modules.auth.presentation.dto.LogoutRequest;
import com.discussboard.backend.modules.auth.presentation.dto.MemberJoinRequest;
import com.discussboard.backend.modules.auth.presentation.dto.ModeratorJoinRequest;
import com.discussboard.backend.modules.auth.presentation.dto.ModeratorResponse;
import com.discussboard.backend.modules.auth.presentation.dto.RefreshRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@Tag(name = "Auth", description = "Join, login and token refresh for members, moderators and administrators")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Register a member account")
    @PostMapping("/member/join")
    public ResponseEntity<AuthorizedActorResponse> joinMember(@Valid @RequestBody MemberJoinRequest request,
                                                              HttpServletRequest servletRequest) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.joinMember(request, clientOf(servletRequest)));
    }

    @PostMapping("/member/login")
    public ResponseEntity<AuthorizedActorResponse> loginMember(@Valid @RequestBody LoginRequest request,
                                                               HttpServletRequest servletRequest) {
        return ResponseEntity.ok(authService.login(ActorType.MEMBER, request, clientOf(servletRequest)));
    }

    @PostMapping("/member/refresh")
    public ResponseEntity<AuthorizedActorResponse> refreshMember(@Valid @RequestBody RefreshRequest request,
                                                                 HttpServletRequest servletRequest) {
        return ResponseEntity.ok(authService.refresh(ActorType.MEMBER, request, clientOf(servletRequest)));
    }

    @Operation(summary = "Assign moderator rights to an existing member")
    @PostMapping("/moderator/join")
    public ResponseEntity<ModeratorResponse> joinModerator(@Valid @RequestBody ModeratorJoinRequest request) {
        ModeratorResponse response = authService.joinModerator(SecurityUtils.getCurrentMemberId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/moderator/login")
    public ResponseEntity<AuthorizedActorResponse> loginModerator(@Valid @RequestBody LoginRequest request,
                                                                  HttpServletRequest servletRequest) {
        return ResponseEntity.ok(authService.login(ActorType.MODERATOR, request, clientOf(servletRequest)));
    }

    @PostMapping("/moderator/refresh")
    public ResponseEntity<AuthorizedActorResponse> refreshModerator(@Valid @RequestBody RefreshRequest request,
                                                                    HttpServletRequest servletRequest) {
        return ResponseEntity.ok(authService.refresh(ActorType.MODERATOR, request, clientOf(servletRequest)));
    }

    @Operation(summary = "Bootstrap an administrator account")
    @PostMapping("/administrator/join")
    public ResponseEntity<AuthorizedActorResponse> joinAdministrator(
            @Valid @RequestBody AdministratorJoinRequest request,
            HttpServletRequest servletRequest
    ) {
        AuthorizedActorResponse response = authService.joinAdministrator(request, clientOf(servletRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/administrator/login")
    public ResponseEntity<AuthorizedActorResponse> loginAdministrator(@Valid @RequestBody LoginRequest request,
                                                                      HttpServletRequest servletRequest) {
        return ResponseEntity.ok(authService.login(ActorType.ADMINISTRATOR, request, clientOf(servletRequest)));
    }

    @PostMapping("/administrator/refresh")
    public ResponseEntity<AuthorizedActorResponse> refreshAdministrator(@Valid @RequestBody RefreshRequest request,
                                                                        HttpServletRequest servletRequest) {
        return ResponseEntity.ok(authService.refresh(ActorType.ADMINISTRATOR, request, clientOf(servletRequest)));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody LogoutRequest request) {
        authService.logout(request);
        return ResponseEntity.noContent().build();
    }

    private ClientInfo clientOf(HttpServletRequest request) {
        return new ClientInfo(request.getHeader(HttpHeaders.USER_AGENT), request.getRemoteAddr());
    }
}
