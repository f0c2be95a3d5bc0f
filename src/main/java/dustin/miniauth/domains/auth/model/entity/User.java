package dustin.miniauth.domains.auth.model.entity;

import java.time.Instant;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 사용자 엔티티
 * User Entity
 *
 * projectId == null 이면 플랫폼 사용자, 값이 있으면 해당 프로젝트의 최종 사용자.
 * 이메일 유일성은 emailNamespace("platform" 또는 프로젝트 ID) 안에서만 보장된다.
 */
@Entity
@Table(name = "users",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_users_namespace_email", columnNames = {"email_namespace", "email"})
    },
    indexes = {
        @Index(name = "idx_users_project_id", columnList = "project_id")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    public static final String PLATFORM_NAMESPACE = "platform";
    
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;
    
    @Column(nullable = false, length = 255)
    private String email;
    
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;
    
    @Column(name = "full_name", length = 100)
    private String fullName;
    
    @Column(name = "project_id")
    private UUID projectId;
    
    @Column(name = "email_namespace", nullable = false, length = 36)
    private String emailNamespace;
    
    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    public boolean isPlatformUser() {
        return projectId == null;
    }
    
    /**
     * 이메일 유일성 범위 계산
     * Namespace in which an email must be unique
     */
    public static String namespaceOf(UUID projectId) {
        return projectId == null ? PLATFORM_NAMESPACE : projectId.toString();
    }
    
    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
        emailNamespace = namespaceOf(projectId);
    }
    
    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
