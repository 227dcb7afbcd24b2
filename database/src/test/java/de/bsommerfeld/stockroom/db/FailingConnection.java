package de.bsommerfeld.stockroom.db;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps a real JDBC connection and makes selected transaction calls fail
 * once armed. Everything else is forwarded unchanged.
 */
final class FailingConnection {

    enum Fault {
        BEGIN,
        COMMIT,
        ROLLBACK
    }

    private final Connection real;
    private final AtomicInteger rollbacks = new AtomicInteger();
    private final Set<Fault> armed = EnumSet.noneOf(Fault.class);

    FailingConnection(Connection real) {
        this.real = real;
    }

    Connection proxy() {
        return (Connection) Proxy.newProxyInstance(
                FailingConnection.class.getClassLoader(),
                new Class<?>[] { Connection.class },
                (proxy, method, args) -> {
                    switch (method.getName()) {
                        case "setAutoCommit" -> {
                            if (armed.contains(Fault.BEGIN) && Boolean.FALSE.equals(args[0])) {
                                throw new SQLException("injected begin failure");
                            }
                        }
                        case "commit" -> {
                            if (armed.contains(Fault.COMMIT)) {
                                throw new SQLException("injected commit failure");
                            }
                        }
                        case "rollback" -> {
                            rollbacks.incrementAndGet();
                            if (armed.contains(Fault.ROLLBACK)) {
                                throw new SQLException("injected rollback failure");
                            }
                        }
                        default -> {
                        }
                    }
                    try {
                        return method.invoke(real, args);
                    } catch (InvocationTargetException e) {
                        throw e.getCause();
                    }
                });
    }

    void arm(Fault... faults) {
        armed.addAll(List.of(faults));
    }

    void disarm() {
        armed.clear();
    }

    /** Rollback calls seen since creation. */
    int rollbacks() {
        return rollbacks.get();
    }
}
