package io.tongchi.alert;

import io.tongchi.concurrent.OperationContext;

import java.util.Map;

@FunctionalInterface
public interface StatusPoller {
    Map<String, String> poll(OperationContext context) throws Exception;
}
