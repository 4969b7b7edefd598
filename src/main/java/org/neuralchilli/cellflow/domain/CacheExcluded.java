package org.neuralchilli.cellflow.domain;

import com.fasterxml.jackson.annotation.JacksonAnnotationsInside;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a stage argument that does not take part in the task's cache key.
 * <p>
 * Components holding a resource gate or a loaded model must carry this
 * annotation; the graph builder rejects argument records that leave one of
 * them unmarked.
 */
@Documented
@JacksonAnnotationsInside
@JsonIgnore
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD, ElementType.METHOD})
public @interface CacheExcluded {
}
