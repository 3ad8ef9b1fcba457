package io.tongchi.schedule;

import io.tongchi.concurrent.OperationContext;

import java.time.Duration;

@FunctionalInterface
public interface LeaseRenewer {
    Duration renew(String leaseId, OperationContext context) throws Exception;
}
