package dustin.miniauth.domains.project.repository;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.miniauth.domains.project.model.entity.Project;

/**
 * 프로젝트 Repository
 * Project Repository
 * 삭제된(비활성) 프로젝트는 조회 대상에서 제외한다
 */
@Repository
public interface ProjectRepository extends JpaRepository<Project, UUID> {
    
    Optional<Project> findByIdAndActiveTrue(UUID id);
    
    /**
     * 사용자가 소유하거나 멤버로 속한 활성 프로젝트 목록
     * Active projects owned by, or shared with, the user
     */
    @Query(value = "SELECT p FROM Project p WHERE p.active = true AND (p.ownerId = :userId OR p.id IN " +
                   "(SELECT m.projectId FROM ProjectMember m WHERE m.userId = :userId)) ORDER BY p.createdAt DESC",
           countQuery = "SELECT COUNT(p) FROM Project p WHERE p.active = true AND (p.ownerId = :userId OR p.id IN " +
                   "(SELECT m.projectId FROM ProjectMember m WHERE m.userId = :userId))")
    Page<Project> findAccessibleByUserId(@Param("userId") UUID userId, Pageable pageable);
}
