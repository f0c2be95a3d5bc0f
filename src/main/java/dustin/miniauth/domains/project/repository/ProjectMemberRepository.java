package dustin.miniauth.domains.project.repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.miniauth.domains.project.model.entity.ProjectMember;

/**
 * 프로젝트 멤버 Repository
 * Project Member Repository
 */
@Repository
public interface ProjectMemberRepository extends JpaRepository<ProjectMember, UUID> {
    
    Optional<ProjectMember> findByProjectIdAndUserId(UUID projectId, UUID userId);
    
    boolean existsByProjectIdAndUserId(UUID projectId, UUID userId);
    
    List<ProjectMember> findByProjectIdOrderByCreatedAtAsc(UUID projectId);
    
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ProjectMember m WHERE m.projectId = :projectId")
    int deleteAllByProjectId(@Param("projectId") UUID projectId);
}
