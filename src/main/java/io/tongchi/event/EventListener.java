package io.tongchi.event;

@FunctionalInterface
public interface EventListener {
    void onEvent(CoreEvent event);
}
