package dustin.miniauth.domains.project.service;

import dustin.miniauth.domains.project.model.entity.Project;
import dustin.miniauth.domains.project.model.entity.ProjectRole;
import lombok.Value;

/**
 * 조회된 프로젝트와 호출자의 역할
 * A loaded project together with the caller's role in it
 */
@Value
public class ProjectAccess {
    Project project;
    ProjectRole role;

    public boolean isOwner() {
        return role == ProjectRole.OWNER;
    }
}
