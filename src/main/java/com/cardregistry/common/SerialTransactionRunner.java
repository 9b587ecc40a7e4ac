package com.cardregistry.common;

import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs registry operations one at a time, each in its own transaction.
 *
 * The lock is taken before the transaction begins and released after it commits or
 * rolls back, so no operation can observe another one half-applied. Reentrant: an
 * operation may call another registry operation on the same thread.
 */
@Component
public class SerialTransactionRunner {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;

    public SerialTransactionRunner(PlatformTransactionManager transactionManager) {
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
    }

    public <T> T call(Supplier<T> work) {
        return execute(writeTemplate, work);
    }

    public void run(Runnable work) {
        execute(writeTemplate, () -> {
            work.run();
            return null;
        });
    }

    public <T> T query(Supplier<T> work) {
        return execute(readTemplate, work);
    }

    private <T> T execute(TransactionTemplate template, Supplier<T> work) {
        lock.lock();
        try {
            return template.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }
}
