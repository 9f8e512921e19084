package com.linetrap.engine;

/**
 * Callable stored in the constant pool of instrumented units and invoked by every trap call.
 *
 * <p>Implementations run inline with the instrumented code on whatever thread executes it. They
 * must not block and must not throw.</p>
 */
@FunctionalInterface
public interface LineHook {
    void onLine(LineDescriptor descriptor);
}
