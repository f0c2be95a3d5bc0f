package dustin.miniauth.domains.auth.repository;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.miniauth.domains.auth.model.entity.User;
import jakarta.persistence.LockModeType;

/**
 * 사용자 Repository
 * User Repository
 * 모든 이메일 조회는 namespace("platform" 또는 프로젝트 ID) 범위 안에서만 수행한다
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {
    
    /**
     * namespace 안에서 이메일로 사용자 조회
     * Find user by email within a namespace
     */
    Optional<User> findByEmailNamespaceAndEmail(String emailNamespace, String email);
    
    /**
     * namespace 안에서 이메일 존재 여부 확인
     * Check if email exists within a namespace
     */
    boolean existsByEmailNamespaceAndEmail(String emailNamespace, String email);
    
    /**
     * 사용자 행 잠금 조회 (로그인 / 전체 로그아웃 직렬화용)
     * Find user with pessimistic write lock
     *
     * 같은 사용자에 대한 로그인(토큰 발급)과 전체 로그아웃(일괄 폐기)이
     * 서로를 보지 못하는 상황을 막는다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM User u WHERE u.id = :userId")
    Optional<User> findByIdForUpdate(@Param("userId") UUID userId);
}
