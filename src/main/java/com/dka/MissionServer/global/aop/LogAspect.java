package com.dka.MissionServer.global.aop;

import com.dka.MissionServer.global.result.ActionResult;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;

import java.util.Arrays;

/**
 * 서비스 호출 추적. 거절/무시된 요청은 사유 코드와 함께 남기고,
 * 방 락 대기 등으로 오래 걸린 호출은 경고한다.
 */
@Slf4j
@Aspect
@Component
public class LogAspect {

    static final long SLOW_CALL_MS = 1000L;

    @Pointcut("execution(public * com.dka.MissionServer.feature..*Service.*(..))")
    public void serviceLayer() {}

    @Around("serviceLayer()")
    public Object traceServiceCall(ProceedingJoinPoint joinPoint) throws Throwable {
        String call = joinPoint.getSignature().getDeclaringType().getSimpleName()
                + "." + joinPoint.getSignature().getName();
        StopWatch stopWatch = new StopWatch(call);
        stopWatch.start();

        Object result;
        try {
            result = joinPoint.proceed();
        } catch (Throwable e) {
            log.error("[FAIL] {} | Args: {} | Msg: {}", call, Arrays.deepToString(joinPoint.getArgs()), e.getMessage(), e);
            throw e;
        } finally {
            stopWatch.stop();
        }

        long elapsedMs = stopWatch.getTotalTimeMillis();
        if (elapsedMs >= SLOW_CALL_MS) {
            log.warn("[SLOW] {} | {}ms | Args: {}", call, elapsedMs, Arrays.deepToString(joinPoint.getArgs()));
        }

        if (result instanceof ActionResult && !((ActionResult) result).isSuccess()) {
            log.debug("[{}] {} | Args: {}", result, call, Arrays.deepToString(joinPoint.getArgs()));
        } else {
            log.trace("[OK] {} | {}ms | Result: {}", call, elapsedMs, result);
        }
        return result;
    }
}
