package io.tongchi.tree;

import io.tongchi.concurrent.OperationContext;
import io.tongchi.model.ChildDescriptor;

import java.util.List;

@FunctionalInterface
public interface Lister {
    List<ChildDescriptor> list(String path, OperationContext context) throws Exception;
}
