package io.tongchi.schedule;

import io.tongchi.concurrent.OperationContext;

@FunctionalInterface
public interface TaskBody {
    void run(OperationContext context) throws Exception;
}
