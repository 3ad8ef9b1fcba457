package io.tongchi.process;

import io.tongchi.concurrent.OperationContext;

@FunctionalInterface
public interface LongOperation<T> {
    T run(OperationContext context) throws Exception;
}
