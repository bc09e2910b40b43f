package com.example.officepdf.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a bean method whose wall-clock duration should be logged.
 * Only calls that go through the Spring proxy are measured.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogExecutionTime {
    /**
     * Label used in the log line; defaults to the method signature.
     */
    String value() default "";
}
