package io.cronos.cli;

@FunctionalInterface
public interface ServeRunner {
    int run(boolean restoreOnStart) throws Exception;
}
