package io.tongchi.client;

@FunctionalInterface
public interface ClientFactory<C> {
    C create() throws Exception;
}
