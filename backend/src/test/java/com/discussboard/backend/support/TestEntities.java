package com.discussboard.backend.support;

import java.lang.reflect.Field;
import java.util.UUID;

import com.discussboard.backend.modules.auth.domain.AccountStatus;
import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.auth.domain.MemberStatus;
import com.discussboard.backend.modules.auth.domain.UserAccount;
import com.discussboard.backend.modules.post.domain.Post;
import com.discussboard.backend.modules.post.domain.PostStatus;

/**
 * Builds detached entities with assigned ids for unit tests.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static <T> T withId(T entity, UUID id) {
        try {
            Field idField = entity.getClass().getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(entity, id);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
        return entity;
    }

    public static Member member(String nickname) {
        UserAccount account = withId(new UserAccount(), UUID.randomUUID());
        account.setEmail(nickname + "@example.com");
        account.setPasswordHash("hash");
        account.setStatus(AccountStatus.ACTIVE);

        Member member = withId(new Member(), UUID.randomUUID());
        member.setUserAccount(account);
        member.setNickname(nickname);
        member.setStatus(MemberStatus.ACTIVE);
        return member;
    }

    public static Post post(Member author, String title) {
        Post post = withId(new Post(), UUID.randomUUID());
        post.setAuthor(author);
        post.setTitle(title);
        post.setBody(title + " body");
        post.setBusinessStatus(PostStatus.PUBLIC);
        return post;
    }
}
