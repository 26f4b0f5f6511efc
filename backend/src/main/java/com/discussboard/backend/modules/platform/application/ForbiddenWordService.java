package com.discussboard.backend.modules.platform.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.audit.application.AuditLogService;
import com.discussboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.discussboard.backend.modules.platform.domain.ForbiddenWord;
import com.discussboard.backend.modules.platform.infrastructure.persistence.ForbiddenWordRepository;
import com.discussboard.backend.modules.platform.presentation.dto.ForbiddenWordRequest;
import com.discussboard.backend.modules.platform.presentation.dto.ForbiddenWordResponse;
import com.discussboard.backend.modules.platform.presentation.dto.ForbiddenWordSearchRequest;
import com.discussboard.backend.modules.platform.presentation.dto.ForbiddenWordUpdateRequest;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ForbiddenWordService {

    static final Set<String> SORT_FIELDS = Set.of("createdAt", "updatedAt", "expression");
    private static final String TABLE = "discuss_board_forbidden_words";

    private final ForbiddenWordRepository forbiddenWordRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public ForbiddenWordService(ForbiddenWordRepository forbiddenWordRepository, AuditLogService auditLogService,
                                Clock clock) {
        this.forbiddenWordRepository = forbiddenWordRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Rejects user content containing any active forbidden expression, ignoring case.
     */
    @Transactional(readOnly = true)
    public void assertClean(String... texts) {
        var words = forbiddenWordRepository.findAllActive();
        if (words.isEmpty()) {
            return;
        }
        for (String text : texts) {
            if (text == null) {
                continue;
            }
            String haystack = text.toLowerCase(Locale.ROOT);
            for (ForbiddenWord word : words) {
                if (haystack.contains(word.getExpression().toLowerCase(Locale.ROOT))) {
                    throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "FORBIDDEN_WORD",
                            "Content contains a forbidden expression");
                }
            }
        }
    }

    @Transactional(readOnly = true)
    public PageResponse<ForbiddenWordResponse> search(ForbiddenWordSearchRequest request) {
        return PageResponse.from(forbiddenWordRepository.search(
                PageQuery.likePattern(request.expression()),
                PageQuery.of(request.page(), request.limit(), request.sortBy(), request.sortDirection(), SORT_FIELDS)
        ), ForbiddenWordResponse::from);
    }

    public ForbiddenWordResponse create(UUID actorMemberId, ForbiddenWordRequest request) {
        String expression = request.expression().trim();
        if (forbiddenWordRepository.existsActiveByExpression(expression)) {
            throw ProblemException.conflict("DUPLICATE_FORBIDDEN_WORD", "Expression is already registered");
        }
        ForbiddenWord word = new ForbiddenWord();
        word.setExpression(expression);
        word.setDescription(request.description());
        word = forbiddenWordRepository.save(word);
        audit(actorMemberId, "forbidden_word_create", word);
        return ForbiddenWordResponse.from(word);
    }

    public ForbiddenWordResponse update(UUID actorMemberId, UUID wordId, ForbiddenWordUpdateRequest request) {
        ForbiddenWord word = load(wordId);
        if (request.expression() != null && !request.expression().isBlank()) {
            String expression = request.expression().trim();
            boolean changed = !Objects.equals(expression.toLowerCase(Locale.ROOT),
                    word.getExpression().toLowerCase(Locale.ROOT));
            if (changed && forbiddenWordRepository.existsActiveByExpression(expression)) {
                throw ProblemException.conflict("DUPLICATE_FORBIDDEN_WORD", "Expression is already registered");
            }
            word.setExpression(expression);
        }
        if (request.description() != null) {
            word.setDescription(request.description());
        }
        forbiddenWordRepository.saveAndFlush(word);
        audit(actorMemberId, "forbidden_word_update", word);
        return ForbiddenWordResponse.from(word);
    }

    public void erase(UUID actorMemberId, UUID wordId) {
        ForbiddenWord word = load(wordId);
        word.markDeleted(OffsetDateTime.now(clock));
        forbiddenWordRepository.save(word);
        audit(actorMemberId, "forbidden_word_delete", word);
    }

    private ForbiddenWord load(UUID wordId) {
        return forbiddenWordRepository.findActiveById(wordId)
                .orElseThrow(() -> ProblemException.notFound("FORBIDDEN_WORD_NOT_FOUND", "Forbidden word not found"));
    }

    private void audit(UUID actorMemberId, String category, ForbiddenWord word) {
        auditLogService.record(new AuditLogCommand(
                actorMemberId,
                "administrator",
                category,
                TABLE,
                word.getId(),
                "Forbidden word " + word.getExpression(),
                Map.of("expression", word.getExpression())
        ));
    }
}
