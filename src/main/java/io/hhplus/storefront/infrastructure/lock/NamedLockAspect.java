package io.hhplus.storefront.infrastructure.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.dao.DataAccessException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.lang.reflect.Method;
import java.sql.Connection;

/**
 * 네임드 락 AOP
 *
 * 동작 흐름:
 * 1. SpEL 표현식을 파싱하여 락 이름 생성
 * 2. 락 세션 커넥션에서 GET_LOCK 호출
 * 3. 획득 시 대상 메서드 실행, 실패 시 건너뜀
 * 4. finally 블록에서 같은 세션으로 RELEASE_LOCK 후 커넥션 반납
 *
 * GET_LOCK은 세션 단위이므로 획득과 해제가 반드시 같은 커넥션에서 일어나야 한다.
 * 트랜잭션 밖에서 호출되면 DataSourceUtils가 풀에서 새 커넥션을 꺼내 주고,
 * 대상 메서드 안의 트랜잭션은 각자 다른 커넥션을 사용한다.
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class NamedLockAspect {

    private static final String GET_LOCK = "SELECT GET_LOCK(?, ?)";
    private static final String RELEASE_LOCK = "SELECT RELEASE_LOCK(?)";

    private final DataSource dataSource;
    private final ExpressionParser parser = new SpelExpressionParser();

    @Around("@annotation(io.hhplus.storefront.infrastructure.lock.NamedLock)")
    public Object lock(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        NamedLock namedLock = method.getAnnotation(NamedLock.class);

        String lockName = parseLockName(namedLock.key(), signature, joinPoint.getArgs());

        Connection connection = DataSourceUtils.getConnection(dataSource);
        try {
            JdbcTemplate lockSession = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
            if (!acquire(lockSession, lockName, namedLock.waitSeconds())) {
                log.info("네임드 락 획득 실패, 실행 건너뜀: name={}", lockName);
                return null;
            }

            log.debug("네임드 락 획득: name={}", lockName);
            try {
                return joinPoint.proceed();
            } finally {
                release(lockSession, lockName);
            }
        } finally {
            DataSourceUtils.releaseConnection(connection, dataSource);
        }
    }

    private boolean acquire(JdbcTemplate lockSession, String lockName, int waitSeconds) {
        // 1: 획득, 0: 타임아웃, NULL: 오류
        Integer result = lockSession.queryForObject(GET_LOCK, Integer.class, lockName, waitSeconds);
        return Integer.valueOf(1).equals(result);
    }

    private void release(JdbcTemplate lockSession, String lockName) {
        try {
            lockSession.queryForObject(RELEASE_LOCK, Integer.class, lockName);
            log.debug("네임드 락 해제: name={}", lockName);
        } catch (DataAccessException e) {
            // 커넥션이 닫히면 세션 락도 함께 해제된다
            log.warn("네임드 락 해제 실패: name={}", lockName, e);
        }
    }

    private String parseLockName(String keyExpression, MethodSignature signature, Object[] args) {
        StandardEvaluationContext context = new StandardEvaluationContext();

        String[] parameterNames = signature.getParameterNames();
        for (int i = 0; i < parameterNames.length; i++) {
            context.setVariable(parameterNames[i], args[i]);
        }

        return parser.parseExpression(keyExpression).getValue(context, String.class);
    }
}
