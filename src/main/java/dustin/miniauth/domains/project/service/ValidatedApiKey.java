package dustin.miniauth.domains.project.service;

import java.util.UUID;

import dustin.miniauth.domains.project.model.entity.Project;
import lombok.Value;

/**
 * 검증된 API 키와 그 프로젝트
 * A validated API key and the active project it identifies
 */
@Value
public class ValidatedApiKey {
    UUID keyId;
    Project project;
}
