package net.vigil.Profiler.Aspect;

import net.vigil.Profiler.Agent;
import net.vigil.Profiler.Annotations.Measured;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;

/**
 * Aspect that intercepts @Measured annotated methods and times them through the agent.
 */
@Aspect
public class MeasuredAspect {

    private final Agent agent;

    public MeasuredAspect(Agent agent) {
        this.agent = agent;
    }

    @Around("@annotation(measured)")
    public Object measure(ProceedingJoinPoint pjp, Measured measured) throws Throwable {
        String name = measured.name().isEmpty() ? defaultName(pjp) : measured.name();
        if (measured.appendableCommand()) {
            return agent.measureSection(name, measured.kind(), true, pjp::proceed);
        }
        return agent.measureBlock(name, measured.kind(), pjp::proceed);
    }

    private static String defaultName(ProceedingJoinPoint pjp) {
        MethodSignature signature = (MethodSignature) pjp.getSignature();
        return signature.getDeclaringType().getSimpleName() + "#" + signature.getName();
    }
}
