package com.upstream.gateway.proxy;

import com.upstream.gateway.exception.RequestCancelledException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 调用方持有的取消信号，只作用于上游 HTTP 调用本身
 */
public class CancellationToken {

    private volatile boolean cancelled;
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        for (Runnable listener : listeners) {
            listener.run();
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new RequestCancelledException();
        }
    }

    /**
     * 注册取消回调；已取消时立即执行
     */
    public Registration onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    public interface Registration extends AutoCloseable {

        Registration NONE = () -> {};

        @Override
        void close();
    }
}
