package com.scanreward.api.platform.validation.annotations;

import com.scanreward.api.platform.validation.HttpUrlValidator;
import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Validates the annotated {@link String} as a base HTTP URL that path segments can be appended to.
 * See {@link HttpUrlValidator} for the rules. <b>{@code null} values are considered valid.</b>
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Constraint(validatedBy = HttpUrlValidator.class)
public @interface HttpUrl {

    String message() default "must be an http/https url without query or fragment";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
