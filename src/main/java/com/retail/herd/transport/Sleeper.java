package com.retail.herd.transport;

@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;
}
