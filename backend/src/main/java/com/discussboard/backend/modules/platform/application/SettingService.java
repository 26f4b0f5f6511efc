package com.discussboard.backend.modules.platform.application;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.discussboard.backend.global.common.paging.PageQuery;
import com.discussboard.backend.global.common.paging.PageResponse;
import com.discussboard.backend.global.error.ProblemException;
import com.discussboard.backend.modules.audit.application.AuditLogService;
import com.discussboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.discussboard.backend.modules.platform.domain.Setting;
import com.discussboard.backend.modules.platform.infrastructure.persistence.SettingRepository;
import com.discussboard.backend.modules.platform.presentation.dto.SettingRequest;
import com.discussboard.backend.modules.platform.presentation.dto.SettingResponse;
import com.discussboard.backend.modules.platform.presentation.dto.SettingSearchRequest;
import com.discussboard.backend.modules.platform.presentation.dto.SettingUpdateRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class SettingService {

    static final Set<String> SORT_FIELDS = Set.of("createdAt", "updatedAt", "configKey");
    private static final String TABLE = "discuss_board_settings";

    private final SettingRepository settingRepository;
    private final AuditLogService auditLogService;
    private final ObjectMapper objectMapper;

    public SettingService(SettingRepository settingRepository, AuditLogService auditLogService,
                          ObjectMapper objectMapper) {
        this.settingRepository = settingRepository;
        this.auditLogService = auditLogService;
        this.objectMapper = objectMapper;
    }

    @Transactional(readOnly = true)
    public PageResponse<SettingResponse> search(SettingSearchRequest request) {
        return PageResponse.from(settingRepository.search(
                PageQuery.likePattern(request.configKey()),
                PageQuery.of(request.page(), request.limit(), request.sortBy(), request.sortDirection(), SORT_FIELDS)
        ), SettingResponse::from);
    }

    @Transactional(readOnly = true)
    public SettingResponse get(UUID settingId) {
        return SettingResponse.from(load(settingId));
    }

    public SettingResponse create(UUID actorMemberId, SettingRequest request) {
        String key = request.configKey().trim();
        requireValidJson(request.configJson());
        if (settingRepository.findByConfigKey(key).isPresent()) {
            throw ProblemException.conflict("DUPLICATE_SETTING_KEY", "Setting key already exists");
        }
        Setting setting = new Setting();
        setting.setConfigKey(key);
        setting.setConfigJson(request.configJson());
        setting.setDescription(request.description());
        setting = settingRepository.save(setting);
        audit(actorMemberId, "setting_create", setting);
        return SettingResponse.from(setting);
    }

    public SettingResponse update(UUID actorMemberId, UUID settingId, SettingUpdateRequest request) {
        Setting setting = load(settingId);
        if (request.configKey() != null && !request.configKey().isBlank()) {
            String key = request.configKey().trim();
            settingRepository.findByConfigKey(key)
                    .filter(other -> !other.getId().equals(setting.getId()))
                    .ifPresent(other -> {
                        throw ProblemException.conflict("DUPLICATE_SETTING_KEY", "Setting key already exists");
                    });
            setting.setConfigKey(key);
        }
        if (request.configJson() != null) {
            requireValidJson(request.configJson());
            setting.setConfigJson(request.configJson());
        }
        if (request.description() != null) {
            setting.setDescription(request.description());
        }
        settingRepository.saveAndFlush(setting);
        audit(actorMemberId, "setting_update", setting);
        return SettingResponse.from(setting);
    }

    private Setting load(UUID settingId) {
        return settingRepository.findById(settingId)
                .orElseThrow(() -> ProblemException.notFound("SETTING_NOT_FOUND", "Setting not found"));
    }

    private void requireValidJson(String json) {
        if (json == null || json.isBlank()) {
            throw invalidJson();
        }
        try {
            JsonNode node = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(json);
            if (node == null || node.isMissingNode()) {
                throw invalidJson();
            }
        } catch (JsonProcessingException e) {
            throw invalidJson();
        }
    }

    private static ProblemException invalidJson() {
        return ProblemException.badRequest("INVALID_CONFIG_JSON", "configJson is not valid JSON");
    }

    private void audit(UUID actorMemberId, String category, Setting setting) {
        auditLogService.record(new AuditLogCommand(
                actorMemberId,
                "administrator",
                category,
                TABLE,
                setting.getId(),
                "Setting " + setting.getConfigKey(),
                Map.of("configKey", setting.getConfigKey())
        ));
    }
}
