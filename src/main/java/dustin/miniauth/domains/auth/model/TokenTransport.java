package dustin.miniauth.domains.auth.model;

/**
 * 토큰 전달 방식
 * How issued tokens travel back to the caller
 */
public enum TokenTransport {
    /** httpOnly 쿠키 (플랫폼 대시보드) */
    COOKIE,
    /** 응답 본문 (프로젝트 클라이언트 앱) */
    BODY
}
