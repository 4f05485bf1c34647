package net.tenure.integration.spring.tx;

import net.tenure.adapter.jdbc.TxContext;
import net.tenure.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/** Runs store calls inside a Spring-managed transaction and exposes its connection through {@link TxContext}. */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate template;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.template = new TransactionTemplate(tm);
        this.template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.ds = ds;
    }

    /** Checked exceptions of the body roll the transaction back and reach the caller unwrapped. */
    @Override
    public <T> T required(Callable<T> body) throws Exception {
        try {
            return inTransaction(body);
        } catch (CheckedBodyException e) {
            throw e.checked;
        }
    }

    private <T> T inTransaction(Callable<T> body) {
        return template.execute(status -> {
            if (TxContext.current() != null) {
                return call(body);
            }

            // bind the transaction's physical connection for the JDBC stores
            Connection con = DataSourceUtils.getConnection(ds);
            try {
                TxContext.bind(con);
                return call(body);
            } finally {
                TxContext.unbind();
                DataSourceUtils.releaseConnection(con, ds);
            }
        });
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CheckedBodyException(e);
        }
    }

    // carries a checked exception through TransactionTemplate so it rolls back
    private static final class CheckedBodyException extends RuntimeException {
        final Exception checked;

        CheckedBodyException(Exception checked) {
            super(checked.getMessage(), checked);
            this.checked = checked;
        }
    }
}
