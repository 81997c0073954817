package com.lotledger.repository;

import com.lotledger.exception.PersistenceFailureException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs a ledger mutation as one unit of work: every row written by {@code work} is committed
 * together, or the whole unit is rolled back when {@code work} throws.
 *
 * <p>Business exceptions propagate unchanged. Storage failures ({@link DataAccessException},
 * failed commits) surface as {@link PersistenceFailureException} with the original cause attached.
 */
@Component
public class AtomicOperationRunner {

    private static final Logger log = LoggerFactory.getLogger(AtomicOperationRunner.class);

    private final TransactionTemplate transactionTemplate;

    public AtomicOperationRunner(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> T runAtomically(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.error("Persistence failure during {}, transaction rolled back", operation, e);
            throw new PersistenceFailureException(operation, e);
        }
    }
}
