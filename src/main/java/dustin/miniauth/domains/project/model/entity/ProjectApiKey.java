package dustin.miniauth.domains.project.model.entity;

import java.time.Instant;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 프로젝트 API 키 엔티티
 * Project API Key Entity
 */
@Entity
@Table(name = "project_api_keys", indexes = {
    @Index(name = "idx_project_api_keys_project_id", columnList = "project_id"),
    @Index(name = "idx_project_api_keys_key_value", columnList = "key_value")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectApiKey {
    
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;
    
    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;
    
    @Column(name = "key_value", nullable = false, unique = true, length = 80, updatable = false)
    private String keyValue;
    
    @Column(nullable = false, length = 50)
    private String name;
    
    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;
    
    @Column(name = "last_used_at")
    private Instant lastUsedAt;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
