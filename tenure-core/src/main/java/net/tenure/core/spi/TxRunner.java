package net.tenure.core.spi;

import java.util.concurrent.Callable;

/** Unit of work around store calls. JDBC stores need one; in-memory stores run {@link #direct()}. */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;

    static TxRunner direct() {
        return new TxRunner() {
            @Override
            public <T> T required(Callable<T> body) throws Exception {
                return body.call();
            }
        };
    }
}
