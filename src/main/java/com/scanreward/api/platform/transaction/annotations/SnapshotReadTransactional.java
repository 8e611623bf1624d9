package com.scanreward.api.platform.transaction.annotations;

import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * A meta-annotation for read-only {@link Transactional} work that spans more than one query. All
 * queries in the annotated method read from the same {@link Isolation#REPEATABLE_READ
 * REPEATABLE_READ} snapshot, and {@link Transactional#rollbackFor() rollbackFor} is set to {@link
 * Exception} instead of {@link RuntimeException} and {@link Error}.
 *
 * @see <a
 * href="https://docs.spring.io/spring-framework/reference/data-access/transaction/declarative/rolling-back.html">
 * Rolling back a declarative transaction - Spring documentation</a>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
@Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ, rollbackFor = Exception.class)
public @interface SnapshotReadTransactional {
}
