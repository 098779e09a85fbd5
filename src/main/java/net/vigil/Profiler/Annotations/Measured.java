package net.vigil.Profiler.Annotations;

import net.vigil.Profiler.CustomObject.Section;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Times every invocation of the annotated method.
 *
 * Inside an active trace the invocation becomes a section of that trace; on an idle
 * thread it becomes a job of its own.
 *
 * Requires the bean to be proxied by Spring AOP, which the auto-configuration enables.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Measured {

    /**
     * Name of the section or job. Defaults to {@code SimpleClassName#method}.
     */
    String name() default "";

    /**
     * Category tag of the section.
     */
    String kind() default Section.DEFAULT_KIND;

    /**
     * Merge differently named sibling sections of the same kind into one growing
     * command. Appendable invocations are never promoted to jobs.
     */
    boolean appendableCommand() default false;
}
