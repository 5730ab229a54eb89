package com.residencecare.backend.modules.lifecycle.application;

import java.sql.SQLException;
import java.util.function.Supplier;

import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleFailure;
import com.residencecare.backend.modules.lifecycle.domain.MutationOperation;
import com.residencecare.backend.modules.lifecycle.domain.StorageUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs one mutation as one transaction and turns store failures into lifecycle failures.
 * Constraint violations are translated here, after the rollback, because the store only
 * reports them when the row is flushed.
 */
@Component
public class LifecycleTransactionCoordinator {

    public static final String OCCUPANCY_CONSTRAINT = "uq_resident_active_bed";

    private static final Logger log = LoggerFactory.getLogger(LifecycleTransactionCoordinator.class);

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String FOREIGN_KEY_VIOLATION = "23503";
    private static final String CHECK_VIOLATION = "23514";
    private static final String NOT_NULL_VIOLATION = "23502";

    private final TransactionTemplate transactionTemplate;

    public LifecycleTransactionCoordinator(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <R> R execute(String entityName, MutationOperation operation, Supplier<R> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (EntityLifecycleException ex) {
            log.info("Rejected {} of {}: {}", operation, entityName, ex.getMessage());
            throw ex;
        } catch (DataIntegrityViolationException ex) {
            throw translateIntegrityViolation(entityName, operation, ex);
        } catch (TransientDataAccessException
                 | DataAccessResourceFailureException
                 | CannotCreateTransactionException
                 | TransactionSystemException ex) {
            log.warn("Storage unavailable during {} {}: {}", operation, entityName, ex.getMessage());
            throw new StorageUnavailableException(
                    operation.name().toLowerCase() + " of " + entityName + " could not be committed", ex);
        }
    }

    private RuntimeException translateIntegrityViolation(String entityName, MutationOperation operation,
                                                         DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage() != null ? root.getMessage() : "";
        String sqlState = root instanceof SQLException sqlException ? sqlException.getSQLState() : null;

        if (message.contains(OCCUPANCY_CONSTRAINT)) {
            log.warn("Occupancy conflict while writing {}: {}", entityName, message);
            return new EntityLifecycleException(EntityLifecycleFailure.OCCUPANCY_CONFLICT,
                    "bed is already occupied by another active resident", ex);
        }
        if (UNIQUE_VIOLATION.equals(sqlState)) {
            return new EntityLifecycleException(EntityLifecycleFailure.DUPLICATE_VALUE,
                    entityName + " violates a uniqueness rule: " + firstLine(message), ex);
        }
        if (FOREIGN_KEY_VIOLATION.equals(sqlState)) {
            if (operation == MutationOperation.DELETE) {
                return new EntityLifecycleException(EntityLifecycleFailure.INVALID_VALUE,
                        entityName + " is still referenced: " + firstLine(message), ex);
            }
            return new EntityLifecycleException(EntityLifecycleFailure.REFERENCE_NOT_FOUND,
                    entityName + " references a missing row: " + firstLine(message), ex);
        }
        if (CHECK_VIOLATION.equals(sqlState) || NOT_NULL_VIOLATION.equals(sqlState)) {
            return new EntityLifecycleException(EntityLifecycleFailure.INVALID_VALUE,
                    entityName + " has an invalid value: " + firstLine(message), ex);
        }
        return ex;
    }

    private static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }
}
