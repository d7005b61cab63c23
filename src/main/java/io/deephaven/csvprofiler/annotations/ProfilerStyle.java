package io.deephaven.csvprofiler.annotations;

import org.immutables.value.Value;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The Immutables style shared by the profiler's value types (the run configuration and the detected dialect). The
 * generated {@code ImmutableX} classes are package-private; callers reach them through the static {@code builder()}
 * method declared on each abstract type.
 */
@Target({ElementType.TYPE, ElementType.PACKAGE})
@Retention(RetentionPolicy.CLASS)
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE,
        defaults = @Value.Immutable(copy = false), strictBuilder = false, jdkOnly = true)
public @interface ProfilerStyle {
}
