package com.tictac.server;

import java.util.concurrent.ThreadFactory;

final class DaemonThreadFactory implements ThreadFactory {
    private final String namePrefix;
    private int index = 0;

    DaemonThreadFactory(String namePrefix) {
        this.namePrefix = namePrefix;
    }

    @Override
    public synchronized Thread newThread(Runnable r) {
        Thread t = new Thread(r);
        t.setDaemon(true);
        t.setName(namePrefix + "-" + (++index));
        return t;
    }
}
