package dustin.miniauth.domains.auth.service;

import org.springframework.stereotype.Service;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import dustin.miniauth.domains.auth.config.AuthProperties;
import lombok.extern.slf4j.Slf4j;

/**
 * 비밀번호 서비스
 * Password Service - one-way Argon2id hashing and verification
 *
 * 해시 문자열에 솔트와 비용 파라미터가 함께 인코딩된다 (호출마다 새 솔트).
 * 비교는 libargon2 내부의 상수 시간 비교를 사용한다.
 */
@Slf4j
@Service
public class PasswordService {
    
    private static final String TIMING_DECOY = "mini-auth-timing-decoy";
    
    private final Argon2 argon2 = Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id);
    private final int iterations;
    private final int memoryKb;
    private final int parallelism;
    private final String decoyHash;
    
    public PasswordService(AuthProperties properties) {
        AuthProperties.Password cost = properties.getPassword();
        this.iterations = cost.getIterations();
        this.memoryKb = cost.getMemoryKb();
        this.parallelism = cost.getParallelism();
        this.decoyHash = hash(TIMING_DECOY);
    }
    
    /**
     * 비밀번호 해싱
     * Hash password
     */
    public String hash(String plaintext) {
        char[] chars = plaintext.toCharArray();
        try {
            return argon2.hash(iterations, memoryKb, parallelism, chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }
    
    /**
     * 비밀번호 검증
     * Verify password. A malformed stored hash is a mismatch, never an exception.
     */
    public boolean verify(String plaintext, String passwordHash) {
        if (plaintext == null || passwordHash == null || passwordHash.isEmpty()) {
            return false;
        }
        char[] chars = plaintext.toCharArray();
        try {
            return argon2.verify(passwordHash, chars);
        } catch (RuntimeException e) {
            log.warn("Stored password hash could not be verified: {}", e.getClass().getSimpleName());
            return false;
        } finally {
            argon2.wipeArray(chars);
        }
    }
    
    /**
     * 존재하지 않는 사용자에 대해서도 같은 비용의 검증을 수행
     * Burn one verification so that "unknown user" costs as much as "wrong password"
     */
    public void verifyDecoy(String plaintext) {
        verify(plaintext == null ? "" : plaintext, decoyHash);
    }
}
