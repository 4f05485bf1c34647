package net.tenure.adapter.jdbc;

import java.sql.Connection;

/** Connection of the transaction running on the current thread. */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();
    private TxContext() {}
    public static void bind(Connection c) { LOCAL.set(c); }
    public static Connection current() { return LOCAL.get(); }
    public static void unbind() { LOCAL.remove(); }

    public static Connection require() {
        Connection c = LOCAL.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with a TxRunner)");
        return c;
    }
}
