package dustin.miniauth.shared.model.dto;

import java.util.List;

import org.springframework.data.domain.Page;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 페이징 응답 DTO
 * Page Response DTO
 *
 * Spring 의 Page 를 API 응답으로 내보내기 위한 래퍼
 *
 * 사용 예시:
 * ```java
 * Page<Project> projects = projectRepository.findAccessibleByUserId(userId, pageable);
 * PageResponse<ProjectResponse> response = PageResponse.of(projects, dtoList);
 * ```
 *
 * @param <T> 페이지 항목 타입 (DTO)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {

    /**
     * 현재 페이지의 항목 목록
     * Current page content
     */
    private List<T> content;

    /**
     * 현재 페이지 번호 (0부터 시작)
     * Current page number (0-indexed)
     */
    private int page;

    /**
     * 요청된 페이지 크기 (최대 100)
     * Requested page size, capped at 100
     */
    private int size;

    /**
     * 접근 가능한 전체 항목 수
     * Total number of accessible elements
     */
    private long totalElements;

    /**
     * 전체 페이지 수
     * Total number of pages
     */
    private int totalPages;

    /**
     * 첫 페이지 여부
     * Whether this is the first page
     */
    private boolean first;

    /**
     * 마지막 페이지 여부
     * Whether this is the last page
     */
    private boolean last;

    /**
     * 빈 페이지 여부 (프로젝트가 하나도 없을 때 true)
     * Whether this page is empty
     */
    private boolean empty;

    /**
     * Spring Page 객체로부터 PageResponse 생성
     * Create PageResponse from a Spring Page
     *
     * @param page 조회된 엔티티 페이지
     * @param content DTO 로 변환된 항목 목록
     * @return PageResponse 인스턴스
     */
    public static <T> PageResponse<T> of(Page<?> page, List<T> content) {
        return PageResponse.<T>builder()
                .content(content)
                .page(page.getNumber())
                .size(page.getSize())
                .totalElements(page.getTotalElements())
                .totalPages(page.getTotalPages())
                .first(page.isFirst())
                .last(page.isLast())
                .empty(page.isEmpty())
                .build();
    }
}
