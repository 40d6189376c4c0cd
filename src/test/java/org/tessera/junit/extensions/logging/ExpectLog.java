package org.tessera.junit.extensions.logging;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a log event the annotated test must produce. Matching events are also allowed.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
@Repeatable(ExpectLogs.class)
public @interface ExpectLog {

    LogLevel level();

    /** Regular expression the logger name must match. */
    String loggerPattern() default ".*";

    /** Regular expression the formatted message must match. */
    String messagePattern() default ".*";
}
